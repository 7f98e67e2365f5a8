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
import io.peerauthn.proxy.authentication.TokenPolicy;

/**
 * Authenticates the origin of a request from the verified claims of a token.
 *
 * @param policy The issuer whose claims are used.
 * @see IdentityExtractor#extractFromToken(TokenPolicy, RequestContext, IdentityRecord)
 */
public record TokenAuthenticationMethod(TokenPolicy policy) implements AuthenticationMethod {

    public TokenAuthenticationMethod {
        Objects.requireNonNull(policy, "policy");
    }

    @Override
    public boolean run(RequestContext context, IdentityRecord identity) {
        return IdentityExtractor.extractFromToken(policy, context, identity);
    }
}
