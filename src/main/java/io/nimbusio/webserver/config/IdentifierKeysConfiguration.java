package io.nimbusio.webserver.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

/**
 * Key material for the identifier translator, hex encoded.
 */
public final class IdentifierKeysConfiguration {

    @JsonProperty("cipherKey")
    private String cipherKey;

    @JsonProperty("hmacKey")
    private String hmacKey;

    @JsonProperty("hmacSize")
    private int hmacSize = 16;

    public IdentifierKeysConfiguration() {
    }

    public IdentifierKeysConfiguration(String cipherKey, String hmacKey, int hmacSize) {
        this.cipherKey = cipherKey;
        this.hmacKey = hmacKey;
        this.hmacSize = hmacSize;
    }

    public String getCipherKey() {
        return cipherKey;
    }

    public String getHmacKey() {
        return hmacKey;
    }

    public int getHmacSize() {
        return hmacSize;
    }

    @Override
    public String toString() {
        // never log the keys themselves
        return MoreObjects.toStringHelper(this)
                .add("hmacSize", hmacSize)
                .toString();
    }
}
