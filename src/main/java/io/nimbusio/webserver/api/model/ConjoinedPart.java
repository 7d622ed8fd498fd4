package io.nimbusio.webserver.api.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.List;

/**
 * One uploaded part of an active conjoined archive, together with the segments holding its bytes. Segment offsets
 * are relative to the start of the part.
 */
public final class ConjoinedPart {

    private final int partNumber;
    private final ImmutableList<SegmentRef> segments;
    private final Instant createTime;

    public ConjoinedPart(int partNumber, List<SegmentRef> segments, Instant createTime) {
        Preconditions.checkArgument(partNumber > 0, "part numbers start at 1");
        this.partNumber = partNumber;
        this.segments = ImmutableList.copyOf(segments);
        this.createTime = Preconditions.checkNotNull(createTime);
    }

    public int getPartNumber() {
        return partNumber;
    }

    public List<SegmentRef> getSegments() {
        return segments;
    }

    public long getSize() {
        return segments.stream().mapToLong(SegmentRef::getSize).sum();
    }

    public Instant getCreateTime() {
        return createTime;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("partNumber", partNumber)
                .add("size", getSize())
                .add("createTime", createTime)
                .toString();
    }
}
