/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.peerauthn.proxy.bootstrap;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.peerauthn.proxy.authentication.AuthenticationMethod;
import io.peerauthn.proxy.authentication.AuthenticationMethodService;
import io.peerauthn.proxy.plugin.Plugin;
import io.peerauthn.proxy.plugin.Plugins;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Records the order in which instances are closed.
 */
@Plugin(configType = TrackingAuthenticationMethodService.Config.class)
public class TrackingAuthenticationMethodService implements AuthenticationMethodService<TrackingAuthenticationMethodService.Config> {

    static final List<String> CLOSED = new CopyOnWriteArrayList<>();

    public record Config(@JsonProperty(value = "name", required = true) String name,
                         @JsonProperty("failInitialization") boolean failInitialization) {}

    private @Nullable Config config;

    @Override
    public void initialize(@Nullable Config config) {
        this.config = Plugins.requireConfig(this, config);
        if (this.config.failInitialization()) {
            throw new IllegalStateException("initialization of " + this.config.name() + " failed");
        }
    }

    @Override
    public AuthenticationMethod build() {
        return (context, identity) -> false;
    }

    @Override
    public void close() {
        if (config != null) {
            CLOSED.add(config.name());
        }
    }
}
