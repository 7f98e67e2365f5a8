/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.peerauthn.proxy.authentication;

import java.util.Objects;
import java.util.Optional;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>The identities established for a single request.</p>
 *
 * <p>A record is created by the host proxy for each request and passed to each {@link AuthenticationMethod} in
 * turn. Certificate and token identities are independent: a method only ever writes its own part.</p>
 *
 * <p>Instances are not thread-safe.</p>
 */
public final class IdentityRecord {

    private @Nullable CertificateIdentity certificateIdentity;
    private @Nullable TokenIdentity tokenIdentity;

    public Optional<CertificateIdentity> certificateIdentity() {
        return Optional.ofNullable(certificateIdentity);
    }

    public void setCertificateIdentity(CertificateIdentity certificateIdentity) {
        this.certificateIdentity = Objects.requireNonNull(certificateIdentity, "certificateIdentity");
    }

    public Optional<TokenIdentity> tokenIdentity() {
        return Optional.ofNullable(tokenIdentity);
    }

    public void setTokenIdentity(TokenIdentity tokenIdentity) {
        this.tokenIdentity = Objects.requireNonNull(tokenIdentity, "tokenIdentity");
    }

    /**
     * Removes both identities.
     */
    public void reset() {
        this.certificateIdentity = null;
        this.tokenIdentity = null;
    }

    public IdentityRecord copy() {
        IdentityRecord copy = new IdentityRecord();
        copy.certificateIdentity = this.certificateIdentity;
        copy.tokenIdentity = this.tokenIdentity;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IdentityRecord that)) {
            return false;
        }
        return Objects.equals(certificateIdentity, that.certificateIdentity)
                && Objects.equals(tokenIdentity, that.tokenIdentity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(certificateIdentity, tokenIdentity);
    }

    @Override
    public String toString() {
        return "IdentityRecord[" +
                "certificateIdentity=" + certificateIdentity + ", " +
                "tokenIdentity=" + tokenIdentity + ']';
    }
}
