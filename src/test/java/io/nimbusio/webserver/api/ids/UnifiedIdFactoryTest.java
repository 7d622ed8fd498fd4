package io.nimbusio.webserver.api.ids;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

class UnifiedIdFactoryTest {

    private static final Instant NOW = Instant.parse("2020-06-01T12:00:00Z");

    /**
     * Ids issued within the same millisecond are distinguished by their sequence and stay ordered.
     */
    @Test
    void idsAreStrictlyIncreasingWithinAMillisecond() {
        final UnifiedIdFactory factory = new UnifiedIdFactory(3, Clock.fixed(NOW, ZoneOffset.UTC));
        UnifiedId previous = factory.next();
        for (int i = 0; i < 10000; i++) {
            final UnifiedId current = factory.next();
            Assertions.assertTrue(current.compareTo(previous) > 0, current + " should follow " + previous);
            previous = current;
        }
    }

    /**
     * A clock moving backwards must not produce an id lower than one already issued.
     */
    @Test
    void idsKeepIncreasingWhenTheClockGoesBackwards() {
        final MutableClock clock = new MutableClock(NOW);
        final UnifiedIdFactory factory = new UnifiedIdFactory(3, clock);
        final UnifiedId first = factory.next();
        clock.now = NOW.minusSeconds(60);
        final UnifiedId second = factory.next();
        Assertions.assertTrue(second.compareTo(first) > 0);
    }

    @Test
    void shardIdIsEmbedded() {
        final UnifiedIdFactory factory = new UnifiedIdFactory(5, Clock.fixed(NOW, ZoneOffset.UTC));
        final long value = factory.next().longValue();
        Assertions.assertEquals(5, (value >> UnifiedIdFactory.SEQUENCE_BITS) & UnifiedIdFactory.MAX_SHARD_ID);
    }

    @Test
    void shardIdOutOfRangeIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new UnifiedIdFactory(UnifiedIdFactory.MAX_SHARD_ID + 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new UnifiedIdFactory(-1));
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
