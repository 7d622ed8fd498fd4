package io.nimbusio.webserver.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import java.time.Instant;

/**
 * One version of a key in a listing.
 */
public final class VersionEntry {

    private final String key;
    private final String versionIdentifier;
    private final Instant timestamp;
    private final long size;

    public VersionEntry(String key, String versionIdentifier, Instant timestamp, long size) {
        this.key = key;
        this.versionIdentifier = versionIdentifier;
        this.timestamp = timestamp;
        this.size = size;
    }

    @JsonProperty("key")
    public String getKey() {
        return key;
    }

    @JsonProperty("version_identifier")
    public String getVersionIdentifier() {
        return versionIdentifier;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("size")
    public long getSize() {
        return size;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("key", key)
                .add("versionIdentifier", versionIdentifier)
                .add("timestamp", timestamp)
                .add("size", size)
                .toString();
    }
}
