package io.nimbusio.webserver.api.model;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The result of listing the live keys of a collection. When a delimiter was given, keys sharing a prefix up to the
 * delimiter are rolled up into {@code prefixes} and count against the page size like a key does.
 */
public final class KeyListing {

    private final ImmutableList<ObjectVersion> versions;
    private final ImmutableList<String> prefixes;
    private final boolean truncated;

    public KeyListing(List<ObjectVersion> versions, List<String> prefixes, boolean truncated) {
        this.versions = ImmutableList.copyOf(versions);
        this.prefixes = ImmutableList.copyOf(prefixes);
        this.truncated = truncated;
    }

    public List<ObjectVersion> getVersions() {
        return versions;
    }

    public List<String> getPrefixes() {
        return prefixes;
    }

    public boolean isTruncated() {
        return truncated;
    }
}
