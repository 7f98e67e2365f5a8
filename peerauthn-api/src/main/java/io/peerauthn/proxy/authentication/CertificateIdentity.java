/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.authentication;

import java.util.Objects;

/**
 * The identity established from the peer's TLS certificate.
 *
 * @param user The peer's identity, or the empty string for an anonymous TLS peer.
 */
public record CertificateIdentity(String user) {
    public CertificateIdentity {
        Objects.requireNonNull(user, "user");
    }
}
