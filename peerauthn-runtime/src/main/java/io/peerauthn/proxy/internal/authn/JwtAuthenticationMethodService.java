/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.internal.authn;

import io.peerauthn.proxy.authentication.AuthenticationMethod;
import io.peerauthn.proxy.authentication.AuthenticationMethodService;
import io.peerauthn.proxy.authentication.TokenPolicy;
import io.peerauthn.proxy.plugin.Plugin;
import io.peerauthn.proxy.plugin.Plugins;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Builds {@link TokenAuthenticationMethod}s for a configured issuer.
 */
@Plugin(configType = TokenPolicy.class)
public class JwtAuthenticationMethodService implements AuthenticationMethodService<TokenPolicy> {

    private @Nullable TokenPolicy policy;

    @Override
    public void initialize(@Nullable TokenPolicy config) {
        this.policy = Plugins.requireConfig(this, config);
    }

    @Override
    public AuthenticationMethod build() {
        if (policy == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has not been initialized");
        }
        return new TokenAuthenticationMethod(policy);
    }
}
