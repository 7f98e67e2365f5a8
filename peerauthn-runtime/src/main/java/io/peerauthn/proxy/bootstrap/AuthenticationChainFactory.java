/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.peerauthn.proxy.bootstrap;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.peerauthn.proxy.authentication.AuthenticationMethod;
import io.peerauthn.proxy.authentication.AuthenticationMethodService;
import io.peerauthn.proxy.authentication.AuthnConfig;
import io.peerauthn.proxy.config.AuthenticationMethodDefinition;
import io.peerauthn.proxy.config.ConfigParser;
import io.peerauthn.proxy.config.Configuration;
import io.peerauthn.proxy.config.PluginFactory;
import io.peerauthn.proxy.config.PluginFactoryRegistry;
import io.peerauthn.proxy.internal.authn.AuthenticationChain;
import io.peerauthn.proxy.plugin.PluginConfigurationException;

/**
 * Builds the {@link AuthenticationChain} described by a {@link Configuration}, initializing one
 * {@link AuthenticationMethodService} per configured method. The services are closed by {@link #close()}.
 */
public class AuthenticationChainFactory implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AuthenticationChainFactory.class);

    private final List<AuthenticationMethodService<? super Object>> services = new ArrayList<>();
    private final AuthenticationChain authenticationChain;
    private final AuthnConfig authnConfig;

    public AuthenticationChainFactory(PluginFactoryRegistry pfr, ConfigParser configParser, Configuration configuration) {
        @SuppressWarnings({ "unchecked", "rawtypes" })
        Class<AuthenticationMethodService<? super Object>> type = (Class) AuthenticationMethodService.class;
        PluginFactory<AuthenticationMethodService<? super Object>> pluginFactory = pfr.pluginFactory(type);
        List<AuthenticationMethod> methods = new ArrayList<>(configuration.methods().size());
        try {
            for (AuthenticationMethodDefinition definition : configuration.methods()) {
                Class<?> configType = pluginFactory.configType(definition.type());
                Object config = configParser.convertPluginConfig(definition.type(), definition.config(), configType);
                AuthenticationMethodService<? super Object> service = pluginFactory.pluginInstance(definition.type());
                try {
                    service.initialize(config);
                    services.add(service);
                    methods.add(service.build());
                }
                catch (PluginConfigurationException e) {
                    throw e;
                }
                catch (Exception e) {
                    throw new PluginConfigurationException(
                            "Exception initializing authentication method " + definition.type() + " with config " + config + ": " + e.getMessage(), e);
                }
            }
        }
        catch (RuntimeException e) {
            // close already initialized services
            close();
            throw e;
        }
        this.authenticationChain = new AuthenticationChain(methods);
        this.authnConfig = configuration.authnConfig();
        LOGGER.info("Configured {} authentication method(s) and {} token issuer(s)",
                methods.size(), authnConfig.jwtOutputPayloadLocations().size());
    }

    public AuthenticationChain authenticationChain() {
        return authenticationChain;
    }

    public AuthnConfig authnConfig() {
        return authnConfig;
    }

    @Override
    public void close() {
        RuntimeException firstThrown = null;
        // Close in reverse order of initialization
        for (int i = services.size() - 1; i >= 0; i--) {
            try {
                services.get(i).close();
            }
            catch (RuntimeException e) {
                if (firstThrown == null) {
                    firstThrown = e;
                }
                else {
                    firstThrown.addSuppressed(e);
                }
            }
        }
        services.clear();
        if (firstThrown != null) {
            throw firstThrown;
        }
    }
}
