/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.internal;

import java.util.Objects;
import java.util.Optional;

import javax.net.ssl.SSLSession;

import io.peerauthn.proxy.authentication.AuthnConfig;
import io.peerauthn.proxy.authentication.RequestContext;
import io.peerauthn.proxy.authentication.RequestHeaders;
import io.peerauthn.proxy.internal.tls.SslSessionPeerTlsContext;
import io.peerauthn.proxy.tls.PeerTlsContext;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The {@link RequestContext} of a single request.
 *
 * @param headers The request's headers.
 * @param peerTls The connection's TLS session, or null for a plaintext connection.
 * @param authnConfig The authentication policy.
 */
public record DefaultRequestContext(RequestHeaders headers,
                                    @Nullable PeerTlsContext peerTls,
                                    AuthnConfig authnConfig)
        implements RequestContext {

    public DefaultRequestContext {
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(authnConfig, "authnConfig");
    }

    public static DefaultRequestContext of(RequestHeaders headers,
                                           @Nullable SSLSession session,
                                           AuthnConfig authnConfig) {
        return new DefaultRequestContext(headers, SslSessionPeerTlsContext.from(session).orElse(null), authnConfig);
    }

    @Override
    public Optional<PeerTlsContext> peerTlsContext() {
        return Optional.ofNullable(peerTls);
    }
}
