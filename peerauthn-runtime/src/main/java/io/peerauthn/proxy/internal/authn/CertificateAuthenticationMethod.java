/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.internal.authn;

import java.util.Objects;

import io.peerauthn.proxy.authentication.AuthenticationMethod;
import io.peerauthn.proxy.authentication.IdentityRecord;
import io.peerauthn.proxy.authentication.RequestContext;
import io.peerauthn.proxy.authentication.TlsPolicy;

/**
 * Authenticates the TLS peer of the connection.
 *
 * @param policy The transport requirements.
 * @see IdentityExtractor#extractFromCertificate(TlsPolicy, RequestContext, IdentityRecord)
 */
public record CertificateAuthenticationMethod(TlsPolicy policy) implements AuthenticationMethod {

    public CertificateAuthenticationMethod {
        Objects.requireNonNull(policy, "policy");
    }

    @Override
    public boolean run(RequestContext context, IdentityRecord identity) {
        return IdentityExtractor.extractFromCertificate(policy, context, identity);
    }
}
