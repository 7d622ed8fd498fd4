package io.nimbusio.webserver.api.ids;

import com.google.common.base.Preconditions;

/**
 * A cluster-wide, monotonically ordered identifier for object versions and conjoined archives.
 *
 * Unified IDs are never exposed to clients directly; use {@link IdentifierTranslator} to obtain the public form.
 */
public final class UnifiedId implements Comparable<UnifiedId> {

    private final long value;

    private UnifiedId(long value) {
        this.value = value;
    }

    public static UnifiedId of(long value) {
        Preconditions.checkArgument(value >= 0, "unified id must not be negative: %s", value);
        return new UnifiedId(value);
    }

    public long longValue() {
        return value;
    }

    @Override
    public int compareTo(UnifiedId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value == ((UnifiedId) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
