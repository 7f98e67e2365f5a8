/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.peerauthn.proxy.config;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A configured authentication method.
 *
 * @param type The name of the {@link io.peerauthn.proxy.authentication.AuthenticationMethodService} plugin.
 * @param config The plugin's configuration, converted to its declared config type when the method is built.
 */
public record AuthenticationMethodDefinition(@JsonProperty(value = "type", required = true) String type,
                                             @JsonProperty("config") @Nullable JsonNode config) {
    public AuthenticationMethodDefinition {
        Objects.requireNonNull(type, "type");
        if (config != null && config.isNull()) {
            config = null;
        }
    }
}
