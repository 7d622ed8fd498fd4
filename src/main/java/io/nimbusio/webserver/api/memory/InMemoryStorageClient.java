package io.nimbusio.webserver.api.memory;

import io.nimbusio.webserver.api.backend.StorageClient;
import io.nimbusio.webserver.api.ids.UnifiedId;
import io.nimbusio.webserver.api.model.exceptions.StorageException;
import io.vertx.core.buffer.Buffer;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps segments in memory. Reads complete immediately.
 */
public class InMemoryStorageClient implements StorageClient {

    private final Map<String, Buffer> segments = new ConcurrentHashMap<>();
    private final AtomicLong nextLocation = new AtomicLong();
    private final AtomicLong reads = new AtomicLong();

    @Override
    public CompletableFuture<Buffer> read(String location, long offset, long length) {
        reads.incrementAndGet();
        final CompletableFuture<Buffer> cf = new CompletableFuture<>();
        final Buffer segment = segments.get(location);
        if (segment == null) {
            cf.completeExceptionally(new StorageException("No segment stored at " + location));
        } else if (offset < 0 || length < 0 || offset + length > segment.length()) {
            cf.completeExceptionally(new StorageException(String.format(
                    "Read of %d bytes at %d is outside segment %s of %d bytes",
                    length, offset, location, segment.length())));
        } else {
            cf.complete(segment.getBuffer((int) offset, (int) (offset + length)));
        }
        return cf;
    }

    @Override
    public String write(long collectionId, String key, UnifiedId versionId, int sequenceNo, Buffer data) {
        final String location = String.format("mem://%d/%s/%d/%d",
                collectionId, versionId, sequenceNo, nextLocation.incrementAndGet());
        segments.put(location, data.copy());
        return location;
    }

    @Override
    public void delete(String location) {
        segments.remove(location);
    }

    /**
     * The number of reads issued so far.
     */
    public long getReadCount() {
        return reads.get();
    }

    public int getSegmentCount() {
        return segments.size();
    }
}
