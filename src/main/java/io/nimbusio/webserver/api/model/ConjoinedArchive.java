package io.nimbusio.webserver.api.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import io.nimbusio.webserver.api.ids.UnifiedId;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A conjoined archive: a key being uploaded in several parts.
 *
 * Instances are immutable. {@link #complete(Instant)} and {@link #abort(Instant)} return the terminal copy; exactly one
 * of the completion and abort timestamps is set once the archive is terminal, and neither while it is active.
 */
public final class ConjoinedArchive {

    private final UnifiedId unifiedId;
    private final long collectionId;
    private final String key;
    private final Instant createTime;
    @Nullable
    private final Instant abortTime;
    @Nullable
    private final Instant completeTime;

    private ConjoinedArchive(UnifiedId unifiedId,
                             long collectionId,
                             String key,
                             Instant createTime,
                             @Nullable Instant abortTime,
                             @Nullable Instant completeTime) {
        Preconditions.checkArgument(abortTime == null || completeTime == null,
                "a conjoined archive cannot be both aborted and completed");
        this.unifiedId = Preconditions.checkNotNull(unifiedId);
        this.collectionId = collectionId;
        this.key = Preconditions.checkNotNull(key);
        this.createTime = Preconditions.checkNotNull(createTime);
        this.abortTime = abortTime;
        this.completeTime = completeTime;
    }

    public static ConjoinedArchive active(UnifiedId unifiedId, long collectionId, String key, Instant createTime) {
        return new ConjoinedArchive(unifiedId, collectionId, key, createTime, null, null);
    }

    public ConjoinedArchive complete(Instant when) {
        Preconditions.checkState(getState() == ConjoinedState.ACTIVE, "archive %s is %s", unifiedId, getState());
        return new ConjoinedArchive(unifiedId, collectionId, key, createTime, null, when);
    }

    public ConjoinedArchive abort(Instant when) {
        Preconditions.checkState(getState() == ConjoinedState.ACTIVE, "archive %s is %s", unifiedId, getState());
        return new ConjoinedArchive(unifiedId, collectionId, key, createTime, when, null);
    }

    public UnifiedId getUnifiedId() {
        return unifiedId;
    }

    public long getCollectionId() {
        return collectionId;
    }

    public String getKey() {
        return key;
    }

    public Instant getCreateTime() {
        return createTime;
    }

    public Optional<Instant> getAbortTime() {
        return Optional.ofNullable(abortTime);
    }

    public Optional<Instant> getCompleteTime() {
        return Optional.ofNullable(completeTime);
    }

    public ConjoinedState getState() {
        if (completeTime != null) {
            return ConjoinedState.COMPLETED;
        }
        if (abortTime != null) {
            return ConjoinedState.ABORTED;
        }
        return ConjoinedState.ACTIVE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConjoinedArchive that = (ConjoinedArchive) o;
        return collectionId == that.collectionId &&
                unifiedId.equals(that.unifiedId) &&
                key.equals(that.key) &&
                createTime.equals(that.createTime) &&
                Objects.equals(abortTime, that.abortTime) &&
                Objects.equals(completeTime, that.completeTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unifiedId, collectionId, key, createTime, abortTime, completeTime);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("unifiedId", unifiedId)
                .add("collectionId", collectionId)
                .add("key", key)
                .add("state", getState())
                .toString();
    }
}
