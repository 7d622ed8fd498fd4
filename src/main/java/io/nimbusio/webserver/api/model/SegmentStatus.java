package io.nimbusio.webserver.api.model;

import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Optional;

/**
 * A status row for one segment of an object version, as recorded by the data nodes. Both fields may be missing while a
 * write is still being acknowledged.
 */
public final class SegmentStatus {

    private final int sequenceNo;
    @Nullable
    private final Long size;
    @Nullable
    private final Instant timestamp;

    public SegmentStatus(int sequenceNo, @Nullable Long size, @Nullable Instant timestamp) {
        this.sequenceNo = sequenceNo;
        this.size = size;
        this.timestamp = timestamp;
    }

    public int getSequenceNo() {
        return sequenceNo;
    }

    public Optional<Long> getSize() {
        return Optional.ofNullable(size);
    }

    public Optional<Instant> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("sequenceNo", sequenceNo)
                .add("size", size)
                .add("timestamp", timestamp)
                .toString();
    }
}
