package io.nimbusio.webserver.api.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.nimbusio.webserver.api.ids.UnifiedId;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One version of a key. A version is identified by a {@link UnifiedId} and consists of an ordered list of segments.
 */
public final class ObjectVersion {

    private final long collectionId;
    private final String key;
    private final UnifiedId versionId;
    private final ImmutableList<SegmentRef> segments;
    private final VersionStatus status;
    private final Instant createTime;

    public ObjectVersion(long collectionId,
                         String key,
                         UnifiedId versionId,
                         List<SegmentRef> segments,
                         VersionStatus status,
                         Instant createTime) {
        this.collectionId = collectionId;
        this.key = Preconditions.checkNotNull(key);
        this.versionId = Preconditions.checkNotNull(versionId);
        this.segments = ImmutableList.copyOf(segments);
        this.status = Preconditions.checkNotNull(status);
        this.createTime = Preconditions.checkNotNull(createTime);
    }

    public long getCollectionId() {
        return collectionId;
    }

    public String getKey() {
        return key;
    }

    public UnifiedId getVersionId() {
        return versionId;
    }

    public List<SegmentRef> getSegments() {
        return segments;
    }

    public VersionStatus getStatus() {
        return status;
    }

    public Instant getCreateTime() {
        return createTime;
    }

    public long getSize() {
        return segments.stream().mapToLong(SegmentRef::getSize).sum();
    }

    public ObjectVersion withStatus(VersionStatus newStatus) {
        return new ObjectVersion(collectionId, key, versionId, segments, newStatus, createTime);
    }

    public ObjectVersion withSegments(List<SegmentRef> newSegments) {
        return new ObjectVersion(collectionId, key, versionId, newSegments, status, createTime);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ObjectVersion that = (ObjectVersion) o;
        return collectionId == that.collectionId &&
                key.equals(that.key) &&
                versionId.equals(that.versionId) &&
                segments.equals(that.segments) &&
                status == that.status &&
                createTime.equals(that.createTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collectionId, key, versionId, segments, status, createTime);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("collectionId", collectionId)
                .add("key", key)
                .add("versionId", versionId)
                .add("segments", segments.size())
                .add("status", status)
                .add("createTime", createTime)
                .toString();
    }
}
