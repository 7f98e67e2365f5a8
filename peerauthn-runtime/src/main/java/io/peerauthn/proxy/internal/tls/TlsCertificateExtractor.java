/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.internal.tls;

import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Extracts names from a peer certificate.
 */
public interface TlsCertificateExtractor extends Function<X509Certificate, Stream<String>> {

    enum Asn1SanNameType {
        RFC822(1),
        DNS(2),
        DIR_NAME(4),
        URI(6),
        IP_ADDRESS(7);

        public final int asn1Value;

        Asn1SanNameType(int asn1Value) {
            this.asn1Value = asn1Value;
        }
    }

    /**
     * @param targetType The kind of Subject Alternative Name to extract.
     * @return An extractor for the certificate's SANs of the given type, in certificate order.
     */
    static TlsCertificateExtractor san(Asn1SanNameType targetType) {
        return new TlsCertificateExtractor() {
            @Override
            public Stream<String> apply(X509Certificate x509Certificate) {
                Collection<List<?>> subjectAlternativeNames;
                try {
                    subjectAlternativeNames = x509Certificate.getSubjectAlternativeNames();
                }
                catch (CertificateParsingException e) {
                    return Stream.empty();
                }
                // null when the certificate has no SAN extension
                if (subjectAlternativeNames == null) {
                    return Stream.empty();
                }
                return subjectAlternativeNames.stream().flatMap(san -> {
                    Integer asn1SanType = (Integer) san.get(0);
                    if (asn1SanType == targetType.asn1Value && san.get(1) instanceof String name) {
                        return Stream.of(name);
                    }
                    else {
                        return Stream.empty();
                    }
                });
            }
        };
    }
}
