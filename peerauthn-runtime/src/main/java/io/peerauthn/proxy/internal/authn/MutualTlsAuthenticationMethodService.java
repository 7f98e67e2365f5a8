/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.internal.authn;

import io.peerauthn.proxy.authentication.AuthenticationMethod;
import io.peerauthn.proxy.authentication.AuthenticationMethodService;
import io.peerauthn.proxy.authentication.TlsPolicy;
import io.peerauthn.proxy.plugin.Plugin;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Builds {@link CertificateAuthenticationMethod}s. Without configuration a client certificate is required.
 */
@Plugin(configType = TlsPolicy.class)
public class MutualTlsAuthenticationMethodService implements AuthenticationMethodService<TlsPolicy> {

    private @Nullable TlsPolicy policy;

    @Override
    public void initialize(@Nullable TlsPolicy config) {
        this.policy = config == null ? TlsPolicy.mutualTls() : config;
    }

    @Override
    public AuthenticationMethod build() {
        if (policy == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has not been initialized");
        }
        return new CertificateAuthenticationMethod(policy);
    }
}
