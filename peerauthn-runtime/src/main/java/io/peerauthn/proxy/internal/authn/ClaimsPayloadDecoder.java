/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.internal.authn;

import java.io.IOException;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Decodes the verified claims which the upstream token verifier places in an internal header:
 * a JSON object, base64 encoded with the standard alphabet.
 */
final class ClaimsPayloadDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClaimsPayloadDecoder.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private ClaimsPayloadDecoder() {
    }

    /**
     * Returns the string valued members of the encoded JSON object, in document order.
     * Members with any other kind of value are omitted.
     *
     * @param encoded The header value.
     * @return The string claims, or empty if the value is not base64 encoded JSON object.
     */
    static Optional<Map<String, String>> decode(String encoded) {
        byte[] json;
        try {
            json = Base64.getDecoder().decode(encoded);
        }
        catch (IllegalArgumentException e) {
            LOGGER.debug("Claims payload is not valid base64: {}", e.getMessage());
            return Optional.empty();
        }
        JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        }
        catch (IOException e) {
            LOGGER.debug("Claims payload is not valid JSON: {}", e.getMessage());
            return Optional.empty();
        }
        if (tree == null || !tree.isObject()) {
            LOGGER.debug("Claims payload is not a JSON object");
            return Optional.empty();
        }
        Map<String, String> claims = new LinkedHashMap<>();
        tree.fields().forEachRemaining(member -> {
            if (member.getValue().isTextual()) {
                claims.put(member.getKey(), member.getValue().textValue());
            }
        });
        return Optional.of(Collections.unmodifiableMap(claims));
    }
}
