package io.nimbusio.webserver.api.backend;

import io.nimbusio.webserver.api.ids.UnifiedId;
import io.vertx.core.buffer.Buffer;

import java.util.concurrent.CompletableFuture;

/**
 * Client for the segment storage nodes.
 */
public interface StorageClient {

    /**
     * Read part of a stored segment.
     *
     * @param location where the segment is stored, as returned by {@link #write}
     * @param offset   offset within the segment
     * @param length   number of bytes to read
     */
    CompletableFuture<Buffer> read(String location, long offset, long length);

    /**
     * Store one segment of a version. Blocks until the segment is durable.
     *
     * @return the location of the stored segment
     */
    String write(long collectionId, String key, UnifiedId versionId, int sequenceNo, Buffer data);

    /**
     * Release the space held by a stored segment.
     */
    void delete(String location);
}
