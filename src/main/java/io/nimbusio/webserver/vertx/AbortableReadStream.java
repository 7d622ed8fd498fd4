package io.nimbusio.webserver.vertx;

import io.vertx.core.streams.ReadStream;

/**
 * A {@link ReadStream} that can be told its consumer has gone away.
 */
public interface AbortableReadStream<T> extends ReadStream<T> {

    /**
     * Stop producing data and release any resources held by the stream. No handler is called after this returns.
     */
    void abort();
}
