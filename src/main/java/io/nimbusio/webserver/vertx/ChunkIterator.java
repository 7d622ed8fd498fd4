package io.nimbusio.webserver.vertx;

import io.vertx.core.buffer.Buffer;

import java.util.Iterator;
import java.util.concurrent.CompletableFuture;

/**
 * A single-pass sequence of chunk reads. Each call to {@link #next()} starts reading one chunk; nothing is read until
 * it is called. Once closed, no further reads are started.
 */
public interface ChunkIterator extends Iterator<CompletableFuture<Buffer>>, AutoCloseable {

    @Override
    void close();
}
