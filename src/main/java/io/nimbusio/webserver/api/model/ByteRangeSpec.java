package io.nimbusio.webserver.api.model;

import com.google.common.base.Preconditions;
import io.nimbusio.webserver.api.model.exceptions.InvalidRangeException;
import io.nimbusio.webserver.api.model.exceptions.RangeNotSatisfiableException;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed, not yet resolved, Range header: an offset and an optional inclusive upper bound. The grammar is exactly
 * {@code bytes=<lower>-[<upper>]}; an absent upper bound means "through the end of the object".
 */
public final class ByteRangeSpec {

    private static final Pattern RANGE_PATTERN = Pattern.compile("^bytes=(\\d+)-(\\d*)$");

    private final long offset;
    private final OptionalLong upper;

    private ByteRangeSpec(long offset, OptionalLong upper) {
        this.offset = offset;
        this.upper = upper;
    }

    /**
     * @param upper the inclusive index of the last requested byte
     */
    public static ByteRangeSpec between(long offset, long upper) {
        Preconditions.checkArgument(offset >= 0 && upper >= offset);
        return new ByteRangeSpec(offset, OptionalLong.of(upper));
    }

    public static ByteRangeSpec from(long offset) {
        Preconditions.checkArgument(offset >= 0);
        return new ByteRangeSpec(offset, OptionalLong.empty());
    }

    /**
     * Parse a Range header value.
     *
     * @throws InvalidRangeException if the value does not match the grammar or its lower bound is above its upper
     *                               bound.
     */
    public static ByteRangeSpec parse(String header) {
        Preconditions.checkNotNull(header);
        final Matcher matcher = RANGE_PATTERN.matcher(header.trim());
        if (!matcher.matches()) {
            throw new InvalidRangeException("Invalid range header: " + header);
        }
        try {
            final long lower = Long.parseLong(matcher.group(1));
            if (matcher.group(2).isEmpty()) {
                return from(lower);
            }
            final long upper = Long.parseLong(matcher.group(2));
            if (lower > upper) {
                throw new InvalidRangeException("Range lower bound is above its upper bound: " + header);
            }
            return between(lower, upper);
        } catch (NumberFormatException e) {
            throw new InvalidRangeException("Range bound out of range: " + header, e);
        }
    }

    public long getOffset() {
        return offset;
    }

    /**
     * The inclusive upper bound, or empty for "through the end".
     */
    public OptionalLong getUpper() {
        return upper;
    }

    /**
     * Resolve this range against an object of {@code totalSize} bytes. An upper bound past the end of the object is
     * clamped to the last byte.
     *
     * @throws RangeNotSatisfiableException if the range starts at or after the end of the object.
     */
    public ByteRange resolve(long totalSize) {
        if (offset >= totalSize) {
            throw new RangeNotSatisfiableException(
                    String.format("Range starting at %d is beyond the object size %d", offset, totalSize));
        }
        final long last = totalSize - 1;
        final long end = upper.isPresent() ? Math.min(upper.getAsLong(), last) : last;
        return new ByteRange(offset, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ByteRangeSpec that = (ByteRangeSpec) o;
        return offset == that.offset && upper.equals(that.upper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, upper);
    }

    @Override
    public String toString() {
        return upper.isPresent() ? "bytes=" + offset + "-" + upper.getAsLong() : "bytes=" + offset + "-";
    }
}
