/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.authentication;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * <p>The transport requirements of certificate based authentication.</p>
 *
 * <p>A TLS session is always required. Presenting a client certificate satisfies every policy.
 * A TLS session without a client certificate is accepted only when the client certificate is not required
 * and {@code allowTls} is set; the caller is then anonymous.</p>
 *
 * @param requireClientCertificate Whether a client certificate must be presented.
 * @param allowTls Whether a TLS session without a client certificate is acceptable.
 */
public record TlsPolicy(@JsonProperty("requireClientCertificate") boolean requireClientCertificate,
                        @JsonProperty("allowTls") boolean allowTls) {

    private static final TlsPolicy MUTUAL_TLS = new TlsPolicy(true, false);
    private static final TlsPolicy PERMISSIVE = new TlsPolicy(false, true);

    /**
     * @return A policy that requires a client certificate.
     */
    public static TlsPolicy mutualTls() {
        return MUTUAL_TLS;
    }

    /**
     * @return A policy that accepts TLS sessions with or without a client certificate.
     */
    public static TlsPolicy permissive() {
        return PERMISSIVE;
    }

    public boolean acceptsMissingClientCertificate() {
        return !requireClientCertificate && allowTls;
    }
}
