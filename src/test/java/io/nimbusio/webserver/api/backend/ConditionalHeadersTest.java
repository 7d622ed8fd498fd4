package io.nimbusio.webserver.api.backend;

import io.nimbusio.webserver.api.model.exceptions.InvalidTimestampException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;

class ConditionalHeadersTest {

    private static final Instant STORED = Instant.parse("2021-03-04T05:06:07.250Z");

    @Test
    void noHeadersProceed() {
        Assertions.assertEquals(ConditionalHeaders.Outcome.PROCEED, ConditionalHeaders.NONE.evaluate(STORED));
        Assertions.assertEquals(ConditionalHeaders.Outcome.PROCEED,
                new ConditionalHeaders("  ", "").evaluate(STORED));
    }

    @Test
    void modifiedSinceLaterThanStoredIsNotModified() {
        final ConditionalHeaders headers = new ConditionalHeaders("Thu, 04 Mar 2021 05:06:08 GMT", null);
        Assertions.assertEquals(ConditionalHeaders.Outcome.NOT_MODIFIED, headers.evaluate(STORED));
    }

    /**
     * The stored time is truncated to the second, so a header carrying the same second is not "later".
     */
    @Test
    void modifiedSinceEqualToStoredProceeds() {
        final ConditionalHeaders headers = new ConditionalHeaders("Thu, 04 Mar 2021 05:06:07 GMT", null);
        Assertions.assertEquals(ConditionalHeaders.Outcome.PROCEED, headers.evaluate(STORED));
    }

    @Test
    void unmodifiedSinceEarlierThanStoredFails() {
        final ConditionalHeaders headers = new ConditionalHeaders(null, "Thu, 04 Mar 2021 05:06:06 GMT");
        Assertions.assertEquals(ConditionalHeaders.Outcome.PRECONDITION_FAILED, headers.evaluate(STORED));
        Assertions.assertEquals(ConditionalHeaders.Outcome.PROCEED,
                new ConditionalHeaders(null, "Thu, 04 Mar 2021 05:06:07 GMT").evaluate(STORED));
    }

    @Test
    void unmodifiedSinceIsCheckedFirst() {
        final ConditionalHeaders headers = new ConditionalHeaders(
                "Fri, 05 Mar 2021 00:00:00 GMT", "Wed, 03 Mar 2021 00:00:00 GMT");
        Assertions.assertEquals(ConditionalHeaders.Outcome.PRECONDITION_FAILED, headers.evaluate(STORED));
    }

    @Test
    void unparsableDatesAreRejected() {
        Assertions.assertThrows(InvalidTimestampException.class,
                () -> new ConditionalHeaders("yesterday", null).evaluate(STORED));
        Assertions.assertThrows(InvalidTimestampException.class,
                () -> new ConditionalHeaders(null, "2021-03-04T05:06:07Z").evaluate(STORED));
    }

    /**
     * A failing If-Unmodified-Since does not hide a malformed If-Modified-Since.
     */
    @Test
    void bothDatesAreParsedBeforeComparing() {
        Assertions.assertThrows(InvalidTimestampException.class,
                () -> new ConditionalHeaders("yesterday", "Wed, 03 Mar 2021 00:00:00 GMT").evaluate(STORED));
    }
}
