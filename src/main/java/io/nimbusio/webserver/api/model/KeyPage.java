package io.nimbusio.webserver.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A page of a key listing, as returned to clients.
 */
public final class KeyPage {

    private final ImmutableList<VersionEntry> keyData;
    private final ImmutableList<String> prefixes;
    private final boolean truncated;

    public KeyPage(List<VersionEntry> keyData, List<String> prefixes, boolean truncated) {
        this.keyData = ImmutableList.copyOf(keyData);
        this.prefixes = ImmutableList.copyOf(prefixes);
        this.truncated = truncated;
    }

    @JsonProperty("key_data")
    public List<VersionEntry> getKeyData() {
        return keyData;
    }

    @JsonProperty("prefixes")
    public List<String> getPrefixes() {
        return prefixes;
    }

    @JsonProperty("truncated")
    public boolean isTruncated() {
        return truncated;
    }
}
