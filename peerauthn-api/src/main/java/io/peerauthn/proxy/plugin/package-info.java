/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * <p>Support for plugins.</p>
 *
 * <p>Authentication methods are provided by implementations of
 * {@link io.peerauthn.proxy.authentication.AuthenticationMethodService}. An implementation is made known to the
 * runtime by listing it in a {@code META-INF/services} file, so that it can be discovered by
 * {@link java.util.ServiceLoader}, and by annotating it with {@link io.peerauthn.proxy.plugin.Plugin @Plugin},
 * which names the type of configuration it consumes.</p>
 *
 * <p>Configuration files refer to a plugin implementation by either its fully qualified class name or,
 * where that is not ambiguous, its simple class name.</p>
 */
package io.peerauthn.proxy.plugin;
