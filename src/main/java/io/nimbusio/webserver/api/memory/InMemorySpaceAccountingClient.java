package io.nimbusio.webserver.api.memory;

import io.nimbusio.webserver.api.backend.SpaceAccountingClient;
import io.nimbusio.webserver.api.model.SpaceUsage;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLongArray;

public class InMemorySpaceAccountingClient implements SpaceAccountingClient {

    private static final int ADDED = 0;
    private static final int REMOVED = 1;
    private static final int RETRIEVED = 2;

    private final Map<Long, AtomicLongArray> counters = new ConcurrentHashMap<>();

    @Override
    public void added(long collectionId, Instant when, long bytes) {
        counters(collectionId).addAndGet(ADDED, bytes);
    }

    @Override
    public void removed(long collectionId, Instant when, long bytes) {
        counters(collectionId).addAndGet(REMOVED, bytes);
    }

    @Override
    public void retrieved(long collectionId, Instant when, long bytes) {
        counters(collectionId).addAndGet(RETRIEVED, bytes);
    }

    @Override
    public SpaceUsage getUsage(long collectionId, String collectionName) {
        final AtomicLongArray values = counters(collectionId);
        return new SpaceUsage(collectionName, values.get(ADDED), values.get(REMOVED), values.get(RETRIEVED));
    }

    private AtomicLongArray counters(long collectionId) {
        return counters.computeIfAbsent(collectionId, id -> new AtomicLongArray(3));
    }
}
