package io.nimbusio.webserver.vertx;

import com.google.common.base.Preconditions;
import io.vertx.core.Context;
import io.vertx.core.Handler;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.streams.ReadStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Adapts a {@link ChunkIterator} to a Vert.x {@link ReadStream}.
 *
 * At most one chunk read is outstanding at a time, and a read is only started while the consumer has demand, so a
 * slow consumer (a paused pump) stops reads instead of buffering them. All handlers are called on the context given
 * to the constructor.
 */
public class ChunkReadStream implements AbortableReadStream<Buffer> {

    private static final Logger LOG = LoggerFactory.getLogger(ChunkReadStream.class);

    private final Context context;
    private final ChunkIterator chunks;

    private Handler<Buffer> handler;
    private Handler<Throwable> exceptionHandler;
    private Handler<Void> endHandler;

    private long demand = Long.MAX_VALUE;
    private boolean reading;
    private boolean finished;
    private long bytesRead;

    public ChunkReadStream(Context context, ChunkIterator chunks) {
        this.context = Preconditions.checkNotNull(context);
        this.chunks = Preconditions.checkNotNull(chunks);
    }

    @Override
    public ReadStream<Buffer> exceptionHandler(Handler<Throwable> handler) {
        this.exceptionHandler = handler;
        return this;
    }

    @Override
    public ReadStream<Buffer> handler(Handler<Buffer> handler) {
        this.handler = handler;
        if (handler != null) {
            readNext();
        }
        return this;
    }

    @Override
    public ReadStream<Buffer> pause() {
        demand = 0L;
        return this;
    }

    @Override
    public ReadStream<Buffer> resume() {
        return fetch(Long.MAX_VALUE);
    }

    @Override
    public ReadStream<Buffer> fetch(long amount) {
        Preconditions.checkArgument(amount >= 0, "amount must not be negative");
        demand += amount;
        if (demand < 0L) {
            demand = Long.MAX_VALUE;
        }
        readNext();
        return this;
    }

    @Override
    public ReadStream<Buffer> endHandler(Handler<Void> endHandler) {
        this.endHandler = endHandler;
        return this;
    }

    @Override
    public void abort() {
        if (!finished) {
            LOG.debug("Aborting chunk stream after {} bytes", bytesRead);
        }
        finished = true;
        chunks.close();
    }

    /**
     * The number of bytes handed to the data handler so far.
     */
    public long getBytesRead() {
        return bytesRead;
    }

    private void readNext() {
        if (finished || reading || demand == 0L || handler == null) {
            return;
        }
        if (!chunks.hasNext()) {
            finished = true;
            chunks.close();
            final Handler<Void> endHandler = this.endHandler;
            if (endHandler != null) {
                endHandler.handle(null);
            }
            return;
        }
        reading = true;
        final CompletableFuture<Buffer> chunk = chunks.next();
        chunk.whenComplete((buffer, throwable) -> context.runOnContext(v -> onChunk(buffer, throwable)));
    }

    private void onChunk(Buffer buffer, Throwable throwable) {
        reading = false;
        if (finished) {
            return;
        }
        if (throwable != null) {
            LOG.debug("Error while reading a chunk", throwable);
            finished = true;
            chunks.close();
            final Handler<Throwable> exceptionHandler = this.exceptionHandler;
            if (exceptionHandler != null) {
                exceptionHandler.handle(throwable);
            }
            return;
        }
        if (demand != Long.MAX_VALUE) {
            demand--;
        }
        bytesRead += buffer.length();
        final Handler<Buffer> handler = this.handler;
        if (handler != null) {
            handler.handle(buffer);
        }
        readNext();
    }
}
