/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.authentication;

/**
 * <p>Establishes a caller identity from the evidence carried by a single request, or fails.</p>
 *
 * <p>An {@code AuthenticationMethod} instance is bound to its policy (for example a {@link TlsPolicy} or a
 * {@link TokenPolicy}) when it is constructed by an {@link AuthenticationMethodService}, so that callers can run
 * an ordered list of configured methods without knowing what kind each one is.</p>
 *
 * <p>Implementations must be stateless with respect to requests: the same instance is invoked concurrently
 * for many requests, each with its own {@link RequestContext} and {@link IdentityRecord}.</p>
 */
public interface AuthenticationMethod {

    /**
     * Attempts to establish an identity for the request described by the given {@code context}.
     * On success the corresponding part of {@code identity} is written and {@code true} is returned.
     * On failure {@code false} is returned and {@code identity} is left exactly as it was.
     * Failure is an ordinary outcome, so implementations do not throw for missing or malformed evidence.
     *
     * @param context The request being authenticated.
     * @param identity The identity record to populate. Not retained beyond the call.
     * @return true if an identity was established.
     */
    boolean run(RequestContext context, IdentityRecord identity);
}
