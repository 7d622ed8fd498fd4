package io.nimbusio.webserver.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A customer signing key loaded at startup by the in-memory key store.
 */
public final class CustomerKeySeed {

    @JsonProperty("owner")
    private String owner;

    @JsonProperty("keyId")
    private String keyId;

    @JsonProperty("secret")
    private String secret;

    public String getOwner() {
        return owner;
    }

    public String getKeyId() {
        return keyId;
    }

    public String getSecret() {
        return secret;
    }
}
