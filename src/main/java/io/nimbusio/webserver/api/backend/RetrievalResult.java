package io.nimbusio.webserver.api.backend;

import com.google.common.base.Preconditions;
import io.nimbusio.webserver.api.model.ObjectMetadata;
import io.nimbusio.webserver.vertx.ChunkIterator;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * What a retrieval produced: the object content, or one of the two conditional short circuits, which carry metadata
 * only.
 */
public final class RetrievalResult {

    public enum Kind {
        CONTENT,
        NOT_MODIFIED,
        PRECONDITION_FAILED
    }

    private final Kind kind;
    private final ObjectMetadata metadata;
    @Nullable
    private final ChunkIterator chunks;

    private RetrievalResult(Kind kind, ObjectMetadata metadata, @Nullable ChunkIterator chunks) {
        this.kind = kind;
        this.metadata = Preconditions.checkNotNull(metadata);
        this.chunks = chunks;
    }

    public static RetrievalResult content(ObjectMetadata metadata, ChunkIterator chunks) {
        return new RetrievalResult(Kind.CONTENT, metadata, Preconditions.checkNotNull(chunks));
    }

    public static RetrievalResult notModified(ObjectMetadata metadata) {
        return new RetrievalResult(Kind.NOT_MODIFIED, metadata, null);
    }

    public static RetrievalResult preconditionFailed(ObjectMetadata metadata) {
        return new RetrievalResult(Kind.PRECONDITION_FAILED, metadata, null);
    }

    public Kind getKind() {
        return kind;
    }

    public ObjectMetadata getMetadata() {
        return metadata;
    }

    /**
     * The content, present only for {@link Kind#CONTENT}. Nothing is read from storage until the iterator is
     * advanced; callers that do not stream the content must close it.
     */
    public Optional<ChunkIterator> getChunks() {
        return Optional.ofNullable(chunks);
    }
}
