package io.nimbusio.webserver.api.auth;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A signing key of a customer. The secret never leaves this object except to compute signatures.
 */
public final class CustomerKey {

    private final String owner;
    private final String keyId;
    private final String secret;

    public CustomerKey(String owner, String keyId, String secret) {
        this.owner = Preconditions.checkNotNull(owner);
        this.keyId = Preconditions.checkNotNull(keyId);
        this.secret = Preconditions.checkNotNull(secret);
    }

    public String getOwner() {
        return owner;
    }

    public String getKeyId() {
        return keyId;
    }

    String getSecret() {
        return secret;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("owner", owner)
                .add("keyId", keyId)
                .toString();
    }
}
