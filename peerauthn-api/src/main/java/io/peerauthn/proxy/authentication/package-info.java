/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * <p>The API for establishing caller identities at a proxy's request authentication boundary.</p>
 *
 * <p>For each request the host proxy creates a {@link io.peerauthn.proxy.authentication.RequestContext} and an
 * empty {@link io.peerauthn.proxy.authentication.IdentityRecord}, then runs the configured
 * {@link io.peerauthn.proxy.authentication.AuthenticationMethod}s. Certificate based methods derive the peer's
 * identity from its TLS certificate; token based methods derive it from claims which an upstream component has
 * already verified and placed in an internal header.</p>
 *
 * <p>Neither kind of method verifies anything itself: certificate chains are validated by the transport, and
 * token signatures and expiry by the upstream verifier.</p>
 */
package io.peerauthn.proxy.authentication;
