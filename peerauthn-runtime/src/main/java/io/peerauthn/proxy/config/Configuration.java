/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.peerauthn.proxy.config;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.peerauthn.proxy.authentication.AuthnConfig;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The root of the authentication configuration.
 *
 * @param jwtOutputPayloadLocations For each token issuer, the internal header carrying its verified claims.
 * @param methods The authentication methods, in the order they are tried.
 */
public record Configuration(@JsonProperty("jwtOutputPayloadLocations") Map<String, String> jwtOutputPayloadLocations,
                            @JsonProperty("methods") List<AuthenticationMethodDefinition> methods) {

    public Configuration(@Nullable Map<String, String> jwtOutputPayloadLocations,
                         @Nullable List<AuthenticationMethodDefinition> methods) {
        this.jwtOutputPayloadLocations = jwtOutputPayloadLocations == null ? Map.of() : Map.copyOf(jwtOutputPayloadLocations);
        this.methods = methods == null ? List.of() : List.copyOf(methods);
    }

    public AuthnConfig authnConfig() {
        return new AuthnConfig(jwtOutputPayloadLocations);
    }
}
