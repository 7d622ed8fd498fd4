package io.nimbusio.webserver.api.model;

import io.nimbusio.webserver.api.model.exceptions.InvalidRangeException;
import io.nimbusio.webserver.api.model.exceptions.RangeNotSatisfiableException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

class ByteRangeSpecTest {

    @Test
    void parseClosedRange() {
        final ByteRangeSpec spec = ByteRangeSpec.parse("bytes=2-5");
        Assertions.assertEquals(2, spec.getOffset());
        Assertions.assertEquals(OptionalLong.of(5), spec.getUpper());
    }

    @Test
    void parseSingleByteRange() {
        Assertions.assertEquals(ByteRangeSpec.between(7, 7), ByteRangeSpec.parse("bytes=7-7"));
    }

    @Test
    void parseOpenRange() {
        final ByteRangeSpec spec = ByteRangeSpec.parse("bytes=10-");
        Assertions.assertEquals(10, spec.getOffset());
        Assertions.assertFalse(spec.getUpper().isPresent());
    }

    @Test
    void parseRejectsMalformedHeaders() {
        for (String header : new String[]{"bytes=10-5", "notbytes=1-2", "bytes=-5", "bytes=1-2,4-5", "bytes=a-b",
                "bytes=99999999999999999999-"}) {
            Assertions.assertThrows(InvalidRangeException.class, () -> ByteRangeSpec.parse(header), header);
        }
    }

    @Test
    void resolveClampsTheUpperBound() {
        final ByteRange range = ByteRangeSpec.parse("bytes=5-100").resolve(10);
        Assertions.assertEquals(5, range.getStart());
        Assertions.assertEquals(9, range.getEnd());
    }

    /**
     * The largest upper bound the grammar allows still parses, and resolves to the end of the object.
     */
    @Test
    void parseLargestUpperBound() {
        final ByteRangeSpec spec = ByteRangeSpec.parse("bytes=0-9223372036854775807");
        Assertions.assertEquals(0, spec.getOffset());
        Assertions.assertEquals(OptionalLong.of(Long.MAX_VALUE), spec.getUpper());

        final ByteRange range = spec.resolve(10);
        Assertions.assertEquals(0, range.getStart());
        Assertions.assertEquals(9, range.getEnd());
        Assertions.assertEquals(10, range.getLength());

        final ByteRange tail = ByteRangeSpec.parse("bytes=9223372036854775806-9223372036854775807")
                .resolve(Long.MAX_VALUE);
        Assertions.assertEquals(Long.MAX_VALUE - 1, tail.getEnd());
        Assertions.assertEquals(1, tail.getLength());
    }

    @Test
    void resolveOpenRangeRunsToTheEnd() {
        final ByteRange range = ByteRangeSpec.from(3).resolve(10);
        Assertions.assertEquals(3, range.getStart());
        Assertions.assertEquals(9, range.getEnd());
    }

    @Test
    void resolveRejectsRangesPastTheEnd() {
        Assertions.assertThrows(RangeNotSatisfiableException.class, () -> ByteRangeSpec.parse("bytes=10-20").resolve(10));
        Assertions.assertThrows(RangeNotSatisfiableException.class, () -> ByteRangeSpec.from(0).resolve(0));
    }
}
