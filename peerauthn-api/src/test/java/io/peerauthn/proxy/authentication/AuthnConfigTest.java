/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.peerauthn.proxy.authentication;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AuthnConfigTest {

    @Test
    void payloadLocationPerIssuer() {
        var config = new AuthnConfig(Map.of(
                "issuer@foo.com", "sec-istio-auth-jwt-output",
                "other@bar.com", "sec-istio-auth-userinfo"));

        assertThat(config.payloadLocation("issuer@foo.com")).hasValue("sec-istio-auth-jwt-output");
        assertThat(config.payloadLocation("other@bar.com")).hasValue("sec-istio-auth-userinfo");
        assertThat(config.payloadLocation("unknown@baz.com")).isEmpty();
        assertThat(config.payloadLocation("")).isEmpty();
    }

    @Test
    void issuersAreCaseSensitive() {
        var config = new AuthnConfig(Map.of("issuer@foo.com", "sec-istio-auth-jwt-output"));

        assertThat(config.payloadLocation("Issuer@Foo.com")).isEmpty();
    }

    @Test
    void nullMeansNoIssuers() {
        assertThat(new AuthnConfig(null)).isEqualTo(AuthnConfig.empty());
        assertThat(AuthnConfig.empty().jwtOutputPayloadLocations()).isEmpty();
    }

    @Test
    void isACopy() {
        // Given
        Map<String, String> locations = new HashMap<>();
        var config = new AuthnConfig(locations);

        // When
        locations.put("issuer@foo.com", "sec-istio-auth-jwt-output");

        // Then
        assertThat(config.payloadLocation("issuer@foo.com")).isEmpty();
    }
}
