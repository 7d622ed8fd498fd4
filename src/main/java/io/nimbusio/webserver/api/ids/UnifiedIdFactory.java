package io.nimbusio.webserver.api.ids;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import java.time.Clock;

/**
 * Issues {@link UnifiedId}s for one shard (web writer node).
 *
 * Layout, from the most significant bit: 41 bits of milliseconds since {@link #EPOCH_MILLIS}, 10 bits of shard ID
 * and 12 bits of per-millisecond sequence. Values are strictly increasing for a factory even if the wall clock moves
 * backwards; in that case the factory keeps issuing from its last timestamp until the clock catches up.
 */
public final class UnifiedIdFactory {

    /**
     * 2010-01-01T00:00:00Z.
     */
    static final long EPOCH_MILLIS = 1262304000000L;

    static final int SHARD_BITS = 10;
    static final int SEQUENCE_BITS = 12;
    static final long MAX_SHARD_ID = (1L << SHARD_BITS) - 1;
    private static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;

    private final long shardId;
    private final Clock clock;

    private long lastMillis = -1L;
    private long sequence = 0L;

    public UnifiedIdFactory(long shardId) {
        this(shardId, Clock.systemUTC());
    }

    @VisibleForTesting
    UnifiedIdFactory(long shardId, Clock clock) {
        Preconditions.checkArgument(shardId >= 0 && shardId <= MAX_SHARD_ID,
                "shard id must be between 0 and %s, got %s", MAX_SHARD_ID, shardId);
        this.shardId = shardId;
        this.clock = clock;
    }

    public synchronized UnifiedId next() {
        long millis = Math.max(clock.millis() - EPOCH_MILLIS, 0L);
        if (millis <= lastMillis) {
            millis = lastMillis;
            sequence++;
            if (sequence > MAX_SEQUENCE) {
                // sequence space for this millisecond is used up, borrow the next one
                millis = lastMillis + 1;
                sequence = 0;
            }
        } else {
            sequence = 0;
        }
        lastMillis = millis;
        return UnifiedId.of((millis << (SHARD_BITS + SEQUENCE_BITS)) | (shardId << SEQUENCE_BITS) | sequence);
    }

    public long getShardId() {
        return shardId;
    }
}
