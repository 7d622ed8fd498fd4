package io.nimbusio.webserver.api.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Optional;

/**
 * Metadata describing a retrieval: what the client asked for and what will be (or would have been) sent.
 *
 * {@code contentLength} is the total size for a full read and the resolved range length for a ranged read. The version
 * identifier is always the public form.
 */
public final class ObjectMetadata {

    private final String key;
    private final String versionIdentifier;
    private final String contentType;
    private final long totalSize;
    private final Instant lastModified;
    @Nullable
    private final ByteRange range;

    public ObjectMetadata(String key,
                          String versionIdentifier,
                          String contentType,
                          long totalSize,
                          Instant lastModified,
                          @Nullable ByteRange range) {
        this.key = Preconditions.checkNotNull(key);
        this.versionIdentifier = Preconditions.checkNotNull(versionIdentifier);
        this.contentType = Preconditions.checkNotNull(contentType);
        this.totalSize = totalSize;
        this.lastModified = Preconditions.checkNotNull(lastModified);
        this.range = range;
    }

    public String getKey() {
        return key;
    }

    public String getVersionIdentifier() {
        return versionIdentifier;
    }

    public String getContentType() {
        return contentType;
    }

    public long getTotalSize() {
        return totalSize;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    public Optional<ByteRange> getRange() {
        return Optional.ofNullable(range);
    }

    public long getContentLength() {
        return range == null ? totalSize : range.getLength();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("key", key)
                .add("versionIdentifier", versionIdentifier)
                .add("contentType", contentType)
                .add("totalSize", totalSize)
                .add("lastModified", lastModified)
                .add("range", range)
                .toString();
    }
}
