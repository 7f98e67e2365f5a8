/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.internal.authn;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.peerauthn.proxy.authentication.CertificateIdentity;
import io.peerauthn.proxy.authentication.IdentityRecord;
import io.peerauthn.proxy.authentication.RequestContext;
import io.peerauthn.proxy.authentication.TlsPolicy;
import io.peerauthn.proxy.authentication.TokenIdentity;
import io.peerauthn.proxy.authentication.TokenPolicy;
import io.peerauthn.proxy.tag.VisibleForTesting;
import io.peerauthn.proxy.tls.PeerTlsContext;

/**
 * <p>Derives caller identities from request evidence which has already been verified: the peer certificate of
 * the connection's TLS session, or token claims asserted by the upstream verifier in an internal header.</p>
 *
 * <p>Both operations return {@code false} for any missing, unacceptable or malformed evidence, in which case
 * the given {@link IdentityRecord} is not modified. They hold no state and are safe to call concurrently.</p>
 */
public final class IdentityExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(IdentityExtractor.class);

    static final String SPIFFE_PREFIX = "spiffe://";

    static final String ISSUER_CLAIM = "iss";
    static final String SUBJECT_CLAIM = "sub";
    static final String AUDIENCE_CLAIM = "aud";
    static final String PRESENTER_CLAIM = "azp";

    private IdentityExtractor() {
    }

    /**
     * Establishes the identity of the TLS peer.
     * A plaintext connection always fails. A connection without a peer certificate succeeds, anonymously,
     * only when the policy {@linkplain TlsPolicy#acceptsMissingClientCertificate() accepts that}.
     *
     * @param policy The transport requirements.
     * @param context The request.
     * @param identity Receives the {@link CertificateIdentity} on success.
     * @return true if an identity was established.
     */
    public static boolean extractFromCertificate(TlsPolicy policy, RequestContext context, IdentityRecord identity) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(identity, "identity");

        Optional<PeerTlsContext> peerTlsContext = context.peerTlsContext();
        if (peerTlsContext.isEmpty()) {
            LOGGER.debug("Certificate authentication failed: the connection is not using TLS");
            return false;
        }
        String user;
        if (peerTlsContext.get().peerCertificatePresented()) {
            user = peerTlsContext.get().peerCertificateUriSan()
                    .map(IdentityExtractor::userFromUriSan)
                    .orElse("");
        }
        else if (policy.acceptsMissingClientCertificate()) {
            user = "";
        }
        else {
            LOGGER.debug("Certificate authentication failed: no client certificate was presented and {} requires one", policy);
            return false;
        }
        identity.setCertificateIdentity(new CertificateIdentity(user));
        return true;
    }

    /**
     * SPIFFE IDs are reduced to the part following {@code spiffe://}; any other URI is used as is.
     */
    @VisibleForTesting
    static String userFromUriSan(String uriSan) {
        if (uriSan.startsWith(SPIFFE_PREFIX)) {
            return uriSan.substring(SPIFFE_PREFIX.length());
        }
        return uriSan;
    }

    /**
     * Establishes the identity asserted by a verified token from the given issuer.
     * Fails if the issuer is empty or has no configured payload location, or if the request does not carry a
     * decodable claims payload at that location.
     *
     * @param token The token policy naming the issuer.
     * @param context The request.
     * @param identity Receives the {@link TokenIdentity} on success.
     * @return true if an identity was established.
     */
    public static boolean extractFromToken(TokenPolicy token, RequestContext context, IdentityRecord identity) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(identity, "identity");

        String issuer = token.issuer();
        if (issuer.isEmpty()) {
            LOGGER.debug("Token authentication failed: no issuer given");
            return false;
        }
        Optional<String> location = context.authnConfig().payloadLocation(issuer);
        if (location.isEmpty()) {
            LOGGER.debug("Token authentication failed: no payload location is configured for issuer '{}'", issuer);
            return false;
        }
        Optional<String> payload = context.headers().get(location.get());
        if (payload.isEmpty()) {
            LOGGER.debug("Token authentication failed: request has no '{}' header for issuer '{}'", location.get(), issuer);
            return false;
        }
        Optional<Map<String, String>> claims = ClaimsPayloadDecoder.decode(payload.get());
        if (claims.isEmpty()) {
            LOGGER.debug("Token authentication failed: '{}' header for issuer '{}' is malformed", location.get(), issuer);
            return false;
        }
        identity.setTokenIdentity(tokenIdentity(claims.get()));
        return true;
    }

    @VisibleForTesting
    static TokenIdentity tokenIdentity(Map<String, String> claims) {
        String issuer = claims.get(ISSUER_CLAIM);
        String subject = claims.get(SUBJECT_CLAIM);
        String user;
        if (issuer != null && subject != null) {
            user = issuer + "/" + subject;
        }
        else if (issuer != null) {
            user = issuer;
        }
        else if (subject != null) {
            user = subject;
        }
        else {
            user = "";
        }
        // only a single string aud counts as an audience
        String audience = claims.get(AUDIENCE_CLAIM);
        List<String> audiences = audience != null ? List.of(audience) : List.of();
        String presenter = claims.getOrDefault(PRESENTER_CLAIM, "");
        return new TokenIdentity(user, audiences, presenter, claims);
    }
}
