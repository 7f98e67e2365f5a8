/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.internal.authn;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.peerauthn.proxy.authentication.AuthenticationMethod;
import io.peerauthn.proxy.authentication.IdentityRecord;
import io.peerauthn.proxy.authentication.RequestContext;

/**
 * Runs authentication methods in order until one succeeds.
 * Failed methods leave the identity record unchanged, so on success only the succeeding method's identity has
 * been written.
 *
 * @param methods The methods, in the order they are tried.
 */
public record AuthenticationChain(List<AuthenticationMethod> methods) implements AuthenticationMethod {

    private static final Logger LOGGER = LoggerFactory.getLogger(AuthenticationChain.class);

    public AuthenticationChain {
        methods = List.copyOf(methods);
    }

    /**
     * @return true if any method succeeded; false if all failed, or there are no methods.
     */
    @Override
    public boolean run(RequestContext context, IdentityRecord identity) {
        for (AuthenticationMethod method : methods) {
            if (method.run(context, identity)) {
                LOGGER.debug("Authenticated using {}", method);
                return true;
            }
        }
        LOGGER.debug("None of {} authentication method(s) succeeded", methods.size());
        return false;
    }
}
