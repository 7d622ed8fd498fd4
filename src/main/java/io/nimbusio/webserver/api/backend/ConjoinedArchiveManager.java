package io.nimbusio.webserver.api.backend;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.nimbusio.webserver.api.ids.IdentifierTranslator;
import io.nimbusio.webserver.api.ids.UnifiedId;
import io.nimbusio.webserver.api.ids.UnifiedIdFactory;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.api.model.ConjoinedArchive;
import io.nimbusio.webserver.api.model.ConjoinedEntry;
import io.nimbusio.webserver.api.model.ConjoinedPart;
import io.nimbusio.webserver.api.model.ObjectVersion;
import io.nimbusio.webserver.api.model.PaginatedList;
import io.nimbusio.webserver.api.model.SegmentRef;
import io.nimbusio.webserver.api.model.SegmentStatus;
import io.nimbusio.webserver.api.model.VersionStatus;
import io.nimbusio.webserver.api.model.exceptions.ConjoinedConflictException;
import io.nimbusio.webserver.api.model.exceptions.NoSuchConjoinedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * The lifecycle of conjoined (multi-part) archives.
 *
 * An archive starts ACTIVE, with a PENDING object version that shares its id. Parts are appended while it is active.
 * Finishing it publishes the version with the parts' segments in part number order; aborting it discards the parts
 * and the pending version. Both transitions go through a compare-and-set in the archive store, so when they race on one
 * archive exactly one of them wins and the other sees a conflict.
 *
 * Identifiers cross this class's boundary in their public form only.
 */
public class ConjoinedArchiveManager {

    private static final Logger LOG = LoggerFactory.getLogger(ConjoinedArchiveManager.class);

    private final ConjoinedArchiveStore archiveStore;
    private final MetadataClient metadataClient;
    private final StorageClient storageClient;
    private final SpaceAccountingClient accountingClient;
    private final UnifiedIdFactory idFactory;
    private final IdentifierTranslator identifierTranslator;
    private final DependencyCaller dependencyCaller;
    private final Clock clock;

    public ConjoinedArchiveManager(ConjoinedArchiveStore archiveStore,
                                   MetadataClient metadataClient,
                                   StorageClient storageClient,
                                   SpaceAccountingClient accountingClient,
                                   UnifiedIdFactory idFactory,
                                   IdentifierTranslator identifierTranslator,
                                   DependencyCaller dependencyCaller,
                                   Clock clock) {
        this.archiveStore = archiveStore;
        this.metadataClient = metadataClient;
        this.storageClient = storageClient;
        this.accountingClient = accountingClient;
        this.idFactory = idFactory;
        this.identifierTranslator = identifierTranslator;
        this.dependencyCaller = dependencyCaller;
        this.clock = clock;
    }

    public ConjoinedEntry start(Collection collection, String key) {
        final UnifiedId unifiedId = idFactory.next();
        final Instant now = clock.instant();
        final ConjoinedArchive archive = ConjoinedArchive.active(unifiedId, collection.getId(), key, now);
        dependencyCaller.run("insert conjoined archive", () -> {
            archiveStore.insert(archive);
            metadataClient.putVersion(new ObjectVersion(collection.getId(), key, unifiedId, ImmutableList.of(),
                    VersionStatus.PENDING, now));
        });
        LOG.debug("Started conjoined archive {} for {} in {}", unifiedId, key, collection.getName());
        return entry(archive);
    }

    public ConjoinedEntry finish(Collection collection, String key, String conjoinedIdentifier) {
        final ConjoinedArchive archive = requireActive(collection, key, conjoinedIdentifier);
        final ConjoinedArchive completed = archive.complete(clock.instant());
        transition(archive, completed);

        final UnifiedId unifiedId = archive.getUnifiedId();
        dependencyCaller.run("publish conjoined version", () -> {
            final List<ConjoinedPart> parts = archiveStore.getParts(unifiedId);
            final ImmutableList.Builder<SegmentRef> segments = ImmutableList.builder();
            final ImmutableList.Builder<SegmentStatus> statusRows = ImmutableList.builder();
            int sequenceNo = 1;
            long offset = 0;
            for (ConjoinedPart part : parts) {
                for (SegmentRef segment : part.getSegments()) {
                    segments.add(segment.relocate(sequenceNo, offset));
                    statusRows.add(new SegmentStatus(sequenceNo, segment.getSize(), part.getCreateTime()));
                    sequenceNo++;
                    offset += segment.getSize();
                }
            }
            if (parts.isEmpty()) {
                statusRows.add(new SegmentStatus(1, 0L, completed.getCompleteTime().get()));
            }
            metadataClient.putVersion(new ObjectVersion(collection.getId(), key, unifiedId, segments.build(),
                    VersionStatus.LIVE, archive.getCreateTime()));
            metadataClient.putSegmentStatus(collection.getId(), unifiedId, statusRows.build());
            if (!collection.isVersioning()) {
                VersionSupersession.supersedeOlderVersions(metadataClient, collection.getId(), key, unifiedId);
            }
            archiveStore.removeParts(unifiedId);
        });
        LOG.debug("Finished conjoined archive {} for {}", unifiedId, key);
        return entry(completed);
    }

    public ConjoinedEntry abort(Collection collection, String key, String conjoinedIdentifier) {
        final ConjoinedArchive archive = requireActive(collection, key, conjoinedIdentifier);
        final ConjoinedArchive aborted = archive.abort(clock.instant());
        transition(archive, aborted);

        final UnifiedId unifiedId = archive.getUnifiedId();
        dependencyCaller.run("discard conjoined parts", () -> {
            long discarded = 0;
            for (ConjoinedPart part : archiveStore.getParts(unifiedId)) {
                for (SegmentRef segment : part.getSegments()) {
                    storageClient.delete(segment.getStorageLocation());
                }
                discarded += part.getSize();
            }
            archiveStore.removeParts(unifiedId);
            metadataClient.removeVersion(collection.getId(), unifiedId);
            if (discarded > 0) {
                accountingClient.removed(collection.getId(), aborted.getAbortTime().get(), discarded);
            }
        });
        LOG.debug("Aborted conjoined archive {} for {}", unifiedId, key);
        return entry(aborted);
    }

    /**
     * Record an uploaded part of an active archive. A part racing a finish or abort is either added before the archive
     * leaves the active state or rejected.
     *
     * @throws ConjoinedConflictException if the archive is not active or already has a part with this number
     */
    public void appendPart(Collection collection, String key, UnifiedId unifiedId, ConjoinedPart part) {
        final String conjoinedIdentifier = identifierTranslator.publicId(unifiedId);
        requireActive(collection, key, unifiedId, conjoinedIdentifier);
        final ConjoinedArchiveStore.AddPartResult result = dependencyCaller.call("add conjoined part",
                () -> archiveStore.addPart(unifiedId, part));
        switch (result) {
            case ADDED:
                return;
            case DUPLICATE_PART:
                throw new ConjoinedConflictException(String.format(
                        "Conjoined archive %s already has part %d", conjoinedIdentifier, part.getPartNumber()));
            case NOT_ACTIVE:
                throw new ConjoinedConflictException(
                        "Conjoined archive " + conjoinedIdentifier + " was finished or aborted concurrently");
            default:
                throw new IllegalStateException("Unknown add part result " + result);
        }
    }

    /**
     * Look up an archive that parts may still be added to.
     *
     * @throws NoSuchConjoinedException if there is no such archive for this collection and key
     * @throws ConjoinedConflictException if the archive is completed or aborted
     */
    public ConjoinedArchive requireActive(Collection collection, String key, String conjoinedIdentifier) {
        return requireActive(collection, key, identifierTranslator.internalId(conjoinedIdentifier),
                conjoinedIdentifier);
    }

    public PaginatedList<ConjoinedEntry> listArchives(Collection collection,
                                                      int maxCount,
                                                      @Nullable String keyMarker,
                                                      @Nullable String conjoinedIdentifierMarker) {
        Preconditions.checkArgument(maxCount > 0, "maxCount must be positive");
        final UnifiedId idMarker = conjoinedIdentifierMarker == null
                ? null : identifierTranslator.internalId(conjoinedIdentifierMarker);
        final List<ConjoinedArchive> fetched = dependencyCaller.call("list conjoined archives",
                () -> archiveStore.list(collection.getId(), keyMarker, idMarker, maxCount + 1));
        return PaginatedList.fromOverfetched(fetched, maxCount).map(this::entry);
    }

    /**
     * The parts uploaded so far to an active archive, in part number order.
     */
    public PaginatedList<ConjoinedPart> listUploadsInArchive(Collection collection,
                                                             String key,
                                                             String conjoinedIdentifier,
                                                             int maxParts) {
        Preconditions.checkArgument(maxParts > 0, "maxParts must be positive");
        final ConjoinedArchive archive = requireActive(collection, key, conjoinedIdentifier);
        final List<ConjoinedPart> parts = dependencyCaller.call("list conjoined parts",
                () -> archiveStore.getParts(archive.getUnifiedId()));
        return PaginatedList.fromOverfetched(parts, maxParts);
    }

    private ConjoinedArchive requireActive(Collection collection,
                                           String key,
                                           UnifiedId unifiedId,
                                           String conjoinedIdentifier) {
        final ConjoinedArchive archive = dependencyCaller.call("get conjoined archive",
                () -> archiveStore.get(unifiedId))
                .filter(a -> a.getCollectionId() == collection.getId() && a.getKey().equals(key))
                .orElseThrow(() -> new NoSuchConjoinedException(
                        "No conjoined archive " + conjoinedIdentifier + " for key " + key));
        if (archive.getState().isTerminal()) {
            throw new ConjoinedConflictException(
                    "Conjoined archive " + conjoinedIdentifier + " is " + archive.getState());
        }
        return archive;
    }

    private void transition(ConjoinedArchive expected, ConjoinedArchive updated) {
        final boolean swapped = dependencyCaller.call("update conjoined archive",
                () -> archiveStore.compareAndSet(expected, updated));
        if (!swapped) {
            throw new ConjoinedConflictException("Conjoined archive " +
                    identifierTranslator.publicId(expected.getUnifiedId()) + " was finished or aborted concurrently");
        }
    }

    private ConjoinedEntry entry(ConjoinedArchive archive) {
        return ConjoinedEntry.of(archive, identifierTranslator.publicId(archive.getUnifiedId()));
    }
}
