/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.peerauthn.proxy.config;

import org.junit.jupiter.api.Test;

import io.peerauthn.proxy.authentication.AuthenticationMethodService;
import io.peerauthn.proxy.authentication.TlsPolicy;
import io.peerauthn.proxy.authentication.TokenPolicy;
import io.peerauthn.proxy.internal.authn.JwtAuthenticationMethodService;
import io.peerauthn.proxy.internal.authn.MutualTlsAuthenticationMethodService;
import io.peerauthn.proxy.plugin.UnknownPluginInstanceException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceBasedPluginFactoryRegistryTest {

    @SuppressWarnings("rawtypes")
    private final PluginFactory<AuthenticationMethodService> factory = new ServiceBasedPluginFactoryRegistry().pluginFactory(AuthenticationMethodService.class);

    @Test
    void registersFullyQualifiedAndSimpleNames() {
        assertThat(factory.registeredInstanceNames()).contains(
                MutualTlsAuthenticationMethodService.class.getName(),
                MutualTlsAuthenticationMethodService.class.getSimpleName(),
                JwtAuthenticationMethodService.class.getName(),
                JwtAuthenticationMethodService.class.getSimpleName());
    }

    @Test
    void resolvesNewInstances() {
        // When
        var first = factory.pluginInstance("MutualTlsAuthenticationMethodService");
        var second = factory.pluginInstance(MutualTlsAuthenticationMethodService.class.getName());

        // Then
        assertThat(first).isInstanceOf(MutualTlsAuthenticationMethodService.class);
        assertThat(second).isInstanceOf(MutualTlsAuthenticationMethodService.class).isNotSameAs(first);
    }

    @Test
    void resolvesConfigTypes() {
        assertThat(factory.configType("MutualTlsAuthenticationMethodService")).isEqualTo(TlsPolicy.class);
        assertThat(factory.configType("JwtAuthenticationMethodService")).isEqualTo(TokenPolicy.class);
    }

    @Test
    void unknownName() {
        assertThatThrownBy(() -> factory.pluginInstance("NoSuchService"))
                .isExactlyInstanceOf(UnknownPluginInstanceException.class)
                .hasMessageContaining("'NoSuchService'")
                .hasMessageContaining("JwtAuthenticationMethodService")
                .hasMessageEndingWith("Plugins must be loadable by java.util.ServiceLoader and annotated with @Plugin.");
        assertThatThrownBy(() -> factory.configType("NoSuchService"))
                .isExactlyInstanceOf(UnknownPluginInstanceException.class);
    }

    @Test
    void emptyName() {
        assertThatThrownBy(() -> factory.pluginInstance(""))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
