/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.authentication;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token based authentication for tokens from a single issuer.
 *
 * @param issuer The issuer whose verified claims are used. Token authentication always fails for an empty issuer.
 */
public record TokenPolicy(@JsonProperty(value = "issuer", required = true) String issuer) {
    public TokenPolicy {
        Objects.requireNonNull(issuer, "issuer");
    }
}
