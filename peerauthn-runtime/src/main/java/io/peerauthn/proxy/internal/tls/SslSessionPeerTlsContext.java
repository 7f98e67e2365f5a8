/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.internal.tls;

import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.Optional;

import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.peerauthn.proxy.tag.VisibleForTesting;
import io.peerauthn.proxy.tls.PeerTlsContext;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A {@link PeerTlsContext} backed by the {@link SSLSession} of a connection.
 */
public final class SslSessionPeerTlsContext implements PeerTlsContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(SslSessionPeerTlsContext.class);

    private static final TlsCertificateExtractor URI_SAN = TlsCertificateExtractor.san(TlsCertificateExtractor.Asn1SanNameType.URI);

    private final @Nullable X509Certificate peerCertificate;

    @VisibleForTesting
    SslSessionPeerTlsContext(@Nullable X509Certificate peerCertificate) {
        this.peerCertificate = peerCertificate;
    }

    /**
     * @param session The connection's TLS session, or null for a plaintext connection.
     * @return The TLS context, or empty for a plaintext connection.
     */
    public static Optional<PeerTlsContext> from(@Nullable SSLSession session) {
        if (session == null) {
            return Optional.empty();
        }
        return Optional.of(new SslSessionPeerTlsContext(peerTlsCertificate(session)));
    }

    @VisibleForTesting
    static @Nullable X509Certificate peerTlsCertificate(SSLSession session) {
        Certificate[] peerCertificates;
        try {
            peerCertificates = session.getPeerCertificates();
        }
        catch (SSLPeerUnverifiedException e) {
            peerCertificates = null;
        }
        if (peerCertificates == null || peerCertificates.length == 0) {
            return null;
        }
        if (peerCertificates[0] instanceof X509Certificate x509Certificate) {
            return x509Certificate;
        }
        LOGGER.warn("Ignoring peer certificate of unsupported type {}", peerCertificates[0].getType());
        return null;
    }

    @Override
    public boolean peerCertificatePresented() {
        return peerCertificate != null;
    }

    @Override
    public Optional<String> peerCertificateUriSan() {
        if (peerCertificate == null) {
            return Optional.empty();
        }
        return URI_SAN.apply(peerCertificate).findFirst();
    }

    @Override
    public String toString() {
        return "SslSessionPeerTlsContext[" +
                "peerCertificatePresented=" + peerCertificatePresented() + ']';
    }
}
