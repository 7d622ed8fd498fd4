package io.nimbusio.webserver.api.backend;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.nimbusio.webserver.api.common.ContentType;
import io.nimbusio.webserver.api.eventing.EventPublisher;
import io.nimbusio.webserver.api.ids.IdentifierTranslator;
import io.nimbusio.webserver.api.ids.UnifiedId;
import io.nimbusio.webserver.api.model.ByteRange;
import io.nimbusio.webserver.api.model.ByteRangeSpec;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.api.model.ObjectMetadata;
import io.nimbusio.webserver.api.model.ObjectVersion;
import io.nimbusio.webserver.api.model.SegmentRef;
import io.nimbusio.webserver.api.model.SegmentStatus;
import io.nimbusio.webserver.api.model.VersionStatus;
import io.nimbusio.webserver.api.model.exceptions.NoSuchKeyException;
import io.nimbusio.webserver.api.model.exceptions.RecordedFaultException;
import io.nimbusio.webserver.util.WebServerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.net.URLConnection;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves object versions and streams their content.
 *
 * The steps of a retrieval always run in the same order:
 * <ol>
 * <li>resolve the version (the requested one, or the live one) and derive its metadata from the segment status
 * rows; a key that does not resolve is not found whatever the request headers say;</li>
 * <li>parse the Range header;</li>
 * <li>evaluate the conditional headers;</li>
 * <li>resolve the range against the object size.</li>
 * </ol>
 * The content is not read here; the returned result carries a lazy {@link SegmentChunkIterator}.
 */
public class RetrievalEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RetrievalEngine.class);

    private final MetadataClient metadataClient;
    private final StorageClient storageClient;
    private final SpaceAccountingClient accountingClient;
    private final IdentifierTranslator identifierTranslator;
    private final DependencyCaller dependencyCaller;
    private final EventPublisher eventPublisher;
    private final int chunkSize;

    public RetrievalEngine(MetadataClient metadataClient,
                           StorageClient storageClient,
                           SpaceAccountingClient accountingClient,
                           IdentifierTranslator identifierTranslator,
                           DependencyCaller dependencyCaller,
                           EventPublisher eventPublisher,
                           int chunkSize) {
        Preconditions.checkArgument(chunkSize > 0, "chunkSize must be positive");
        this.metadataClient = metadataClient;
        this.storageClient = storageClient;
        this.accountingClient = accountingClient;
        this.identifierTranslator = identifierTranslator;
        this.dependencyCaller = dependencyCaller;
        this.eventPublisher = eventPublisher;
        this.chunkSize = chunkSize;
    }

    /**
     * Retrieve an object.
     *
     * @param versionIdentifier the public identifier of the version to read, or null for the live version
     * @param rangeHeader       the raw Range header, or null for the whole object
     * @throws NoSuchKeyException if the key or version does not resolve to complete metadata
     * @throws io.nimbusio.webserver.api.model.exceptions.InvalidIdentifierException if the version identifier is
     *         malformed
     * @throws io.nimbusio.webserver.api.model.exceptions.InvalidRangeException if the Range header is malformed
     * @throws io.nimbusio.webserver.api.model.exceptions.InvalidTimestampException if a conditional header is not an
     *         HTTP date
     * @throws io.nimbusio.webserver.api.model.exceptions.RangeNotSatisfiableException if the range starts past the
     *         end of the object
     */
    public RetrievalResult retrieve(Collection collection,
                                    String key,
                                    @Nullable String versionIdentifier,
                                    @Nullable String rangeHeader,
                                    ConditionalHeaders conditionals) {
        final ResolvedVersion resolved = resolve(collection, key, versionIdentifier);
        final ByteRangeSpec rangeSpec = rangeHeader == null ? null : ByteRangeSpec.parse(rangeHeader);

        final ObjectMetadata fullMetadata = resolved.toMetadata(null);
        switch (conditionals.evaluate(resolved.lastModified)) {
            case NOT_MODIFIED:
                WebServerMetrics.NOT_MODIFIED.mark();
                return RetrievalResult.notModified(fullMetadata);
            case PRECONDITION_FAILED:
                WebServerMetrics.PRECONDITION_FAILED.mark();
                return RetrievalResult.preconditionFailed(fullMetadata);
            case PROCEED:
                break;
            default:
                throw new IllegalStateException("Unknown conditional outcome");
        }

        final List<SegmentRef> segments = resolved.version.getSegments();
        if (rangeSpec == null) {
            return RetrievalResult.content(fullMetadata,
                    new SegmentChunkIterator(storageClient, segments, 0, resolved.totalSize, chunkSize));
        }
        final ByteRange range = rangeSpec.resolve(resolved.totalSize);
        LOG.debug("Reading {} of {} ({} bytes)", range, key, resolved.totalSize);
        return RetrievalResult.content(resolved.toMetadata(range),
                new SegmentChunkIterator(storageClient, segments, range, chunkSize));
    }

    /**
     * The metadata of an object, without reading it.
     */
    public ObjectMetadata getMetadata(Collection collection, String key, @Nullable String versionIdentifier) {
        return resolve(collection, key, versionIdentifier).toMetadata(null);
    }

    /**
     * Report bytes sent to a client to space accounting.
     */
    public void recordRetrieved(Collection collection, long bytes) {
        if (bytes > 0) {
            WebServerMetrics.BYTES_RETRIEVED.mark(bytes);
            dependencyCaller.run("record retrieved bytes",
                    () -> accountingClient.retrieved(collection.getId(), Instant.now(), bytes));
        }
    }

    private ResolvedVersion resolve(Collection collection, String key, @Nullable String versionIdentifier) {
        final long collectionId = collection.getId();
        final ObjectVersion version;
        if (versionIdentifier == null) {
            version = dependencyCaller.call("get live version",
                    () -> metadataClient.getLiveVersion(collectionId, key))
                    .orElseThrow(() -> new NoSuchKeyException("No such key: " + key));
        } else {
            final UnifiedId versionId = identifierTranslator.internalId(versionIdentifier);
            final Optional<ObjectVersion> found = dependencyCaller.call("get version",
                    () -> metadataClient.getVersion(collectionId, versionId));
            version = found
                    .filter(v -> v.getKey().equals(key))
                    .filter(v -> v.getStatus() == VersionStatus.LIVE || v.getStatus() == VersionStatus.SUPERSEDED)
                    .orElseThrow(() -> new NoSuchKeyException(
                            "No such version " + versionIdentifier + " of key " + key));
        }

        final List<SegmentStatus> statusRows = dependencyCaller.call("get segment status",
                () -> metadataClient.getSegmentStatus(collectionId, version.getVersionId()));
        if (statusRows.isEmpty()) {
            throw new NoSuchKeyException("No segment status for key " + key);
        }
        long totalSize = 0;
        Instant lastModified = null;
        for (SegmentStatus row : statusRows) {
            if (!row.getSize().isPresent() || !row.getTimestamp().isPresent()) {
                throw new NoSuchKeyException("Incomplete segment status for key " + key);
            }
            totalSize += row.getSize().get();
            final Instant timestamp = row.getTimestamp().get();
            if (lastModified == null || timestamp.isAfter(lastModified)) {
                lastModified = timestamp;
            }
        }

        try {
            checkContiguous(version.getSegments(), totalSize);
        } catch (IllegalStateException e) {
            eventPublisher.exception("retrieval-segment-mismatch", e);
            throw new RecordedFaultException(e);
        }

        return new ResolvedVersion(version, identifierTranslator.publicId(version.getVersionId()),
                totalSize, lastModified);
    }

    /**
     * Check that the segments cover {@code [0, totalSize)} without gaps or overlaps.
     *
     * @throws IllegalStateException if they don't
     */
    @VisibleForTesting
    static void checkContiguous(List<SegmentRef> segments, long totalSize) {
        long expectedOffset = 0;
        for (SegmentRef segment : segments) {
            if (segment.getOffset() != expectedOffset) {
                throw new IllegalStateException(String.format(
                        "Segment %d starts at %d, expected %d; segments: %s",
                        segment.getSequenceNo(), segment.getOffset(), expectedOffset, describe(segments)));
            }
            expectedOffset = segment.getEnd();
        }
        if (expectedOffset != totalSize) {
            throw new IllegalStateException(String.format(
                    "Segments cover %d bytes but the status rows report %d", expectedOffset, totalSize));
        }
    }

    private static String describe(List<SegmentRef> segments) {
        return segments.stream()
                .sorted(Comparator.comparingInt(SegmentRef::getSequenceNo))
                .map(s -> s.getOffset() + "+" + s.getSize())
                .collect(Collectors.joining(", "));
    }

    static String guessContentType(String key) {
        final String guessed = URLConnection.guessContentTypeFromName(key);
        return guessed == null ? ContentType.APPLICATION_OCTET_STREAM : guessed;
    }

    private static final class ResolvedVersion {
        private final ObjectVersion version;
        private final String publicVersionId;
        private final long totalSize;
        private final Instant lastModified;

        private ResolvedVersion(ObjectVersion version, String publicVersionId, long totalSize, Instant lastModified) {
            this.version = version;
            this.publicVersionId = publicVersionId;
            this.totalSize = totalSize;
            this.lastModified = lastModified;
        }

        ObjectMetadata toMetadata(@Nullable ByteRange range) {
            return new ObjectMetadata(version.getKey(), publicVersionId, guessContentType(version.getKey()),
                    totalSize, lastModified, range);
        }
    }
}
