/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.authentication;

import edu.umd.cs.findbugs.annotations.UnknownNullness;

/**
 * The service interface used to construct an {@link AuthenticationMethod}.
 *
 * @param <C> The configuration type consumed by the particular {@link AuthenticationMethod} implementation.
 */
public interface AuthenticationMethodService<C> extends AutoCloseable {
    void initialize(@UnknownNullness C config);

    AuthenticationMethod build();

    default void close() {
    }
}
