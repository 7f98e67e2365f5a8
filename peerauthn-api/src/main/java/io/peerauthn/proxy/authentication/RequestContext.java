/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.authentication;

import java.util.Optional;

import io.peerauthn.proxy.tls.PeerTlsContext;

/**
 * <p>A read-only view of the request being authenticated, as seen by an {@link AuthenticationMethod}.</p>
 *
 * <p>A context is created by the host proxy for each inbound request and must not change while an
 * authentication method is running.</p>
 */
public interface RequestContext {

    /**
     * @return The request's headers.
     */
    RequestHeaders headers();

    /**
     * @return The TLS session of the connection the request arrived on, or empty if the connection is plaintext.
     */
    Optional<PeerTlsContext> peerTlsContext();

    /**
     * @return The authentication policy in force for this request.
     */
    AuthnConfig authnConfig();
}
