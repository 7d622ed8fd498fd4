package io.nimbusio.webserver.api.backend;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.nimbusio.webserver.api.ids.IdentifierTranslator;
import io.nimbusio.webserver.api.ids.UnifiedId;
import io.nimbusio.webserver.api.ids.UnifiedIdFactory;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.api.model.ConjoinedPart;
import io.nimbusio.webserver.api.model.ObjectVersion;
import io.nimbusio.webserver.api.model.SegmentRef;
import io.nimbusio.webserver.api.model.SegmentStatus;
import io.nimbusio.webserver.api.model.VersionStatus;
import io.nimbusio.webserver.api.model.exceptions.NoSuchKeyException;
import io.nimbusio.webserver.util.WebServerMetrics;
import io.vertx.core.buffer.Buffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Stores request bodies as object versions, and deletes them.
 *
 * Bodies are split into segments of at most the segment size, written through the storage client, and then recorded
 * in the metadata database: as a new live version for a plain archive, or as a part of a conjoined archive.
 */
public class ArchiveWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveWriter.class);

    private final MetadataClient metadataClient;
    private final StorageClient storageClient;
    private final SpaceAccountingClient accountingClient;
    private final ConjoinedArchiveManager conjoinedArchiveManager;
    private final UnifiedIdFactory idFactory;
    private final IdentifierTranslator identifierTranslator;
    private final DependencyCaller dependencyCaller;
    private final int segmentSize;
    private final Clock clock;

    public ArchiveWriter(MetadataClient metadataClient,
                         StorageClient storageClient,
                         SpaceAccountingClient accountingClient,
                         ConjoinedArchiveManager conjoinedArchiveManager,
                         UnifiedIdFactory idFactory,
                         IdentifierTranslator identifierTranslator,
                         DependencyCaller dependencyCaller,
                         int segmentSize,
                         Clock clock) {
        Preconditions.checkArgument(segmentSize > 0, "segmentSize must be positive");
        this.metadataClient = metadataClient;
        this.storageClient = storageClient;
        this.accountingClient = accountingClient;
        this.conjoinedArchiveManager = conjoinedArchiveManager;
        this.idFactory = idFactory;
        this.identifierTranslator = identifierTranslator;
        this.dependencyCaller = dependencyCaller;
        this.segmentSize = segmentSize;
        this.clock = clock;
    }

    /**
     * Archive a key.
     *
     * @param conjoinedIdentifier the conjoined archive the body is a part of, or null for a plain archive
     * @param partNumber          the part number, required with a conjoined identifier
     * @return the public identifier of the version written to
     */
    public String archive(Collection collection,
                          String key,
                          Buffer body,
                          @Nullable String conjoinedIdentifier,
                          @Nullable Integer partNumber) {
        Preconditions.checkArgument((conjoinedIdentifier == null) == (partNumber == null),
                "a conjoined part needs both an identifier and a part number");
        final long collectionId = collection.getId();

        if (conjoinedIdentifier != null) {
            final UnifiedId archiveId = conjoinedArchiveManager
                    .requireActive(collection, key, conjoinedIdentifier).getUnifiedId();
            final List<SegmentRef> segments = writeSegments(collectionId, key, archiveId, body);
            final ConjoinedPart part = new ConjoinedPart(partNumber, segments, clock.instant());
            try {
                conjoinedArchiveManager.appendPart(collection, key, archiveId, part);
            } catch (RuntimeException e) {
                deleteSegments(segments);
                throw e;
            }
            recordAdded(collectionId, part.getCreateTime(), body.length());
            LOG.debug("Archived part {} ({} bytes) of {} in {}", partNumber, body.length(), key, collection.getName());
            return conjoinedIdentifier;
        }

        final UnifiedId versionId = idFactory.next();
        final List<SegmentRef> segments = writeSegments(collectionId, key, versionId, body);
        final Instant now = clock.instant();
        final ImmutableList.Builder<SegmentStatus> statusRows = ImmutableList.builder();
        for (SegmentRef segment : segments) {
            statusRows.add(new SegmentStatus(segment.getSequenceNo(), segment.getSize(), now));
        }
        if (segments.isEmpty()) {
            statusRows.add(new SegmentStatus(1, 0L, now));
        }

        dependencyCaller.run("record version", () -> {
            metadataClient.putVersion(new ObjectVersion(collectionId, key, versionId, segments,
                    VersionStatus.LIVE, now));
            metadataClient.putSegmentStatus(collectionId, versionId, statusRows.build());
            if (!collection.isVersioning()) {
                VersionSupersession.supersedeOlderVersions(metadataClient, collectionId, key, versionId);
            }
        });
        recordAdded(collectionId, now, body.length());
        WebServerMetrics.ARCHIVES.mark();
        WebServerMetrics.ARCHIVE_SIZE.update(body.length());
        LOG.debug("Archived {} ({} bytes) in {} as {}", key, body.length(), collection.getName(), versionId);
        return identifierTranslator.publicId(versionId);
    }

    /**
     * Delete a key. Without a version identifier the live version is replaced by a tombstone; with one, that version
     * is removed.
     *
     * @throws NoSuchKeyException if there is nothing to delete
     */
    public void delete(Collection collection, String key, @Nullable String versionIdentifier) {
        final long collectionId = collection.getId();
        final Instant now = clock.instant();
        final long removed;
        if (versionIdentifier == null) {
            final ObjectVersion live = dependencyCaller.call("get live version",
                    () -> metadataClient.getLiveVersion(collectionId, key))
                    .orElseThrow(() -> new NoSuchKeyException("No such key: " + key));
            dependencyCaller.run("tombstone version",
                    () -> metadataClient.updateStatus(collectionId, live.getVersionId(), VersionStatus.TOMBSTONE));
            removed = live.getSize();
        } else {
            final UnifiedId versionId = identifierTranslator.internalId(versionIdentifier);
            final ObjectVersion version = dependencyCaller.call("get version",
                    () -> metadataClient.getVersion(collectionId, versionId))
                    .filter(v -> v.getKey().equals(key) && v.getStatus() != VersionStatus.PENDING)
                    .orElseThrow(() -> new NoSuchKeyException(
                            "No such version " + versionIdentifier + " of key " + key));
            dependencyCaller.run("remove version", () -> metadataClient.removeVersion(collectionId, versionId));
            deleteSegments(version.getSegments());
            removed = version.getStatus() == VersionStatus.TOMBSTONE ? 0 : version.getSize();
        }
        if (removed > 0) {
            dependencyCaller.run("record removed bytes", () -> accountingClient.removed(collectionId, now, removed));
        }
        WebServerMetrics.DELETES.mark();
        LOG.debug("Deleted {} in {}", key, collection.getName());
    }

    private List<SegmentRef> writeSegments(long collectionId, String key, UnifiedId versionId, Buffer body) {
        final ImmutableList.Builder<SegmentRef> segments = ImmutableList.builder();
        int sequenceNo = 1;
        for (int offset = 0; offset < body.length(); offset += segmentSize) {
            final int end = Math.min(offset + segmentSize, body.length());
            final Buffer slice = body.getBuffer(offset, end);
            final int segmentNo = sequenceNo;
            final String location = dependencyCaller.call("write segment",
                    () -> storageClient.write(collectionId, key, versionId, segmentNo, slice));
            segments.add(new SegmentRef(sequenceNo, offset, end - offset, location));
            sequenceNo++;
        }
        return segments.build();
    }

    private void deleteSegments(List<SegmentRef> segments) {
        for (SegmentRef segment : segments) {
            dependencyCaller.run("delete segment", () -> storageClient.delete(segment.getStorageLocation()));
        }
    }

    private void recordAdded(long collectionId, Instant when, long bytes) {
        if (bytes > 0) {
            dependencyCaller.run("record added bytes", () -> accountingClient.added(collectionId, when, bytes));
        }
    }
}
