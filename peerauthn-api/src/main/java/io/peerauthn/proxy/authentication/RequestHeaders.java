/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.authentication;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * An immutable view of a request's headers. Header names are compared ignoring case.
 * Each header has a single value.
 */
public final class RequestHeaders {

    private static final RequestHeaders EMPTY = new RequestHeaders(Collections.emptySortedMap());

    private final SortedMap<String, String> headers;

    private RequestHeaders(SortedMap<String, String> headers) {
        this.headers = headers;
    }

    public static RequestHeaders empty() {
        return EMPTY;
    }

    /**
     * Creates headers from the given name to value mapping.
     * @param headers The headers.
     * @return The headers.
     * @throws IllegalArgumentException if two of the given names differ only by case.
     */
    public static RequestHeaders of(Map<String, String> headers) {
        Objects.requireNonNull(headers, "headers");
        if (headers.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, value) -> {
            Objects.requireNonNull(name, "header name");
            Objects.requireNonNull(value, "header value");
            if (copy.put(name, value) != null) {
                throw new IllegalArgumentException("Header '" + name + "' was given more than once (header names are case-insensitive).");
            }
        });
        return new RequestHeaders(Collections.unmodifiableSortedMap(copy));
    }

    /**
     * @param name The header name, in any case.
     * @return The header's value, or empty if the request has no such header.
     */
    public Optional<String> get(String name) {
        Objects.requireNonNull(name, "name");
        return Optional.ofNullable(headers.get(name));
    }

    public boolean contains(String name) {
        return get(name).isPresent();
    }

    public int size() {
        return headers.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RequestHeaders that)) {
            return false;
        }
        return headers.equals(that.headers);
    }

    @Override
    public int hashCode() {
        return headers.hashCode();
    }

    // Values may carry credentials, so only the names are rendered.
    @Override
    public String toString() {
        return "RequestHeaders" + headers.keySet();
    }
}
