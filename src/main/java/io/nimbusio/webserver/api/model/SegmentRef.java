package io.nimbusio.webserver.api.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * One stored slice of an object version: bytes {@code [offset, offset + size)} of the object live at
 * {@code storageLocation}.
 */
public final class SegmentRef {

    private final int sequenceNo;
    private final long offset;
    private final long size;
    private final String storageLocation;

    public SegmentRef(int sequenceNo, long offset, long size, String storageLocation) {
        Preconditions.checkArgument(offset >= 0, "offset must not be negative");
        Preconditions.checkArgument(size >= 0, "size must not be negative");
        this.sequenceNo = sequenceNo;
        this.offset = offset;
        this.size = size;
        this.storageLocation = Preconditions.checkNotNull(storageLocation);
    }

    public int getSequenceNo() {
        return sequenceNo;
    }

    public long getOffset() {
        return offset;
    }

    public long getSize() {
        return size;
    }

    public long getEnd() {
        return offset + size;
    }

    public String getStorageLocation() {
        return storageLocation;
    }

    /**
     * A copy of this segment placed at a different position in the object.
     */
    public SegmentRef relocate(int newSequenceNo, long newOffset) {
        return new SegmentRef(newSequenceNo, newOffset, size, storageLocation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SegmentRef that = (SegmentRef) o;
        return sequenceNo == that.sequenceNo &&
                offset == that.offset &&
                size == that.size &&
                storageLocation.equals(that.storageLocation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequenceNo, offset, size, storageLocation);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("sequenceNo", sequenceNo)
                .add("offset", offset)
                .add("size", size)
                .add("storageLocation", storageLocation)
                .toString();
    }
}
