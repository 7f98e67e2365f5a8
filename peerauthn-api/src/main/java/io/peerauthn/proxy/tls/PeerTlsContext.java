/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.tls;

import java.util.Optional;

import io.peerauthn.proxy.authentication.RequestContext;

/**
 * Exposes information about the TLS session of the connection a request arrived on,
 * for example using {@link RequestContext#peerTlsContext()}.
 * An instance only exists for connections where a TLS session is active.
 * This is implemented by the runtime, or by the host proxy's transport layer.
 */
public interface PeerTlsContext {

    /**
     * @return true if the peer presented a certificate during the TLS handshake.
     */
    boolean peerCertificatePresented();

    /**
     * @return the URI Subject Alternative Name of the peer's certificate, or empty if no certificate was
     * presented or the certificate carries no URI SAN.
     */
    Optional<String> peerCertificateUriSan();
}
