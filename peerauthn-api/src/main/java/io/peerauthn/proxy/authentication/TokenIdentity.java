/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.authentication;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The identity established from a verified token's claims.
 *
 * @param user {@code iss/sub} if both claims are present, otherwise whichever is present, otherwise empty.
 * @param audiences The {@code aud} claim, if present.
 * @param presenter The {@code azp} claim, or empty.
 * @param claims Every string valued claim of the token, including those used to derive the other components.
 */
public record TokenIdentity(String user,
                            List<String> audiences,
                            String presenter,
                            Map<String, String> claims) {
    public TokenIdentity {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(presenter, "presenter");
        audiences = List.copyOf(audiences);
        claims = Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }
}
