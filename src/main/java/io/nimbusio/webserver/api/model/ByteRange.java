package io.nimbusio.webserver.api.model;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * An inclusive byte range {@code [start, end]} that has been resolved against the size of an object.
 */
public final class ByteRange {

    private final long start;
    private final long end;

    public ByteRange(long start, long end) {
        Preconditions.checkArgument(start >= 0, "start must not be negative");
        Preconditions.checkArgument(end >= start, "end must not be before start");
        this.start = start;
        this.end = end;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public long getLength() {
        return end - start + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ByteRange byteRange = (ByteRange) o;
        return start == byteRange.start && end == byteRange.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "bytes " + start + "-" + end;
    }
}
