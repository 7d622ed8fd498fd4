package io.nimbusio.webserver.api.backend;

import com.google.common.base.Preconditions;
import io.nimbusio.webserver.api.model.ByteRange;
import io.nimbusio.webserver.api.model.SegmentRef;
import io.nimbusio.webserver.vertx.ChunkIterator;
import io.vertx.core.buffer.Buffer;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;

/**
 * Reads a byte range of a version, chunk by chunk, from the segments holding it.
 *
 * A chunk is never larger than the chunk size and never straddles two segments. The segments must be contiguous and
 * sorted by offset.
 */
public final class SegmentChunkIterator implements ChunkIterator {

    private final StorageClient storageClient;
    private final List<SegmentRef> segments;
    private final long end;
    private final int chunkSize;

    private long position;
    private int segmentIndex;
    private volatile boolean closed;

    public SegmentChunkIterator(StorageClient storageClient, List<SegmentRef> segments, ByteRange range, int chunkSize) {
        this(storageClient, segments, range.getStart(), range.getLength(), chunkSize);
    }

    /**
     * @param start  offset of the first byte to read
     * @param length number of bytes to read, possibly zero
     */
    public SegmentChunkIterator(StorageClient storageClient,
                                List<SegmentRef> segments,
                                long start,
                                long length,
                                int chunkSize) {
        Preconditions.checkArgument(chunkSize > 0, "chunkSize must be positive");
        Preconditions.checkArgument(start >= 0 && length >= 0);
        this.storageClient = Preconditions.checkNotNull(storageClient);
        this.segments = Preconditions.checkNotNull(segments);
        this.chunkSize = chunkSize;
        this.position = start;
        this.end = start + length;
    }

    @Override
    public boolean hasNext() {
        return !closed && position < end;
    }

    @Override
    public CompletableFuture<Buffer> next() {
        if (!hasNext()) {
            throw new NoSuchElementException(closed ? "chunk iterator is closed" : "no more chunks");
        }
        while (segments.get(segmentIndex).getEnd() <= position) {
            segmentIndex++;
        }
        final SegmentRef segment = segments.get(segmentIndex);
        final long length = Math.min(chunkSize, Math.min(segment.getEnd(), end) - position);
        final long offsetInSegment = position - segment.getOffset();
        position += length;
        return storageClient.read(segment.getStorageLocation(), offsetInSegment, length);
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
