/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.peerauthn.proxy.internal.authn;

import org.junit.jupiter.api.Test;

import io.peerauthn.proxy.authentication.TlsPolicy;
import io.peerauthn.proxy.authentication.TokenPolicy;
import io.peerauthn.proxy.plugin.PluginConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthenticationMethodServiceTest {

    @Test
    void mutualTlsServiceUsesConfiguredPolicy() {
        // Given
        var service = new MutualTlsAuthenticationMethodService();

        // When
        service.initialize(TlsPolicy.permissive());

        // Then
        assertThat(service.build()).isEqualTo(new CertificateAuthenticationMethod(TlsPolicy.permissive()));
    }

    @Test
    void mutualTlsServiceRequiresClientCertificateByDefault() {
        // Given
        var service = new MutualTlsAuthenticationMethodService();

        // When
        service.initialize(null);

        // Then
        assertThat(service.build()).isEqualTo(new CertificateAuthenticationMethod(TlsPolicy.mutualTls()));
    }

    @Test
    void jwtServiceUsesConfiguredIssuer() {
        // Given
        var service = new JwtAuthenticationMethodService();

        // When
        service.initialize(new TokenPolicy("issuer@foo.com"));

        // Then
        assertThat(service.build()).isEqualTo(new TokenAuthenticationMethod(new TokenPolicy("issuer@foo.com")));
    }

    @Test
    void jwtServiceRequiresConfig() {
        var service = new JwtAuthenticationMethodService();
        assertThatThrownBy(() -> service.initialize(null))
                .isExactlyInstanceOf(PluginConfigurationException.class)
                .hasMessage("JwtAuthenticationMethodService requires configuration, but config object is null");
    }

    @Test
    void buildBeforeInitializeIsAnError() {
        assertThatThrownBy(() -> new MutualTlsAuthenticationMethodService().build())
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("MutualTlsAuthenticationMethodService has not been initialized");
        assertThatThrownBy(() -> new JwtAuthenticationMethodService().build())
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("JwtAuthenticationMethodService has not been initialized");
    }
}
