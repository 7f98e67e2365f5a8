/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.authentication;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The authentication policy shared by all requests: for each token issuer, the name of the internal header in
 * which the upstream verifier places that issuer's verified claims.
 *
 * @param jwtOutputPayloadLocations mapping from issuer to header name.
 */
public record AuthnConfig(Map<String, String> jwtOutputPayloadLocations) {

    private static final AuthnConfig EMPTY = new AuthnConfig(Map.of());

    public AuthnConfig(@Nullable Map<String, String> jwtOutputPayloadLocations) {
        this.jwtOutputPayloadLocations = jwtOutputPayloadLocations == null ? Map.of() : Map.copyOf(jwtOutputPayloadLocations);
    }

    public static AuthnConfig empty() {
        return EMPTY;
    }

    /**
     * @param issuer The token issuer.
     * @return The name of the header carrying that issuer's verified claims, or empty if the issuer is not configured.
     */
    public Optional<String> payloadLocation(String issuer) {
        Objects.requireNonNull(issuer, "issuer");
        return Optional.ofNullable(jwtOutputPayloadLocations.get(issuer));
    }
}
