package io.nimbusio.webserver.api.backend;

import io.nimbusio.webserver.api.backend.ConjoinedArchiveStore.AddPartResult;
import io.nimbusio.webserver.api.ids.UnifiedId;
import io.nimbusio.webserver.api.memory.InMemoryConjoinedArchiveStore;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.api.model.ConjoinedArchive;
import io.nimbusio.webserver.api.model.ConjoinedEntry;
import io.nimbusio.webserver.api.model.ConjoinedPart;
import io.nimbusio.webserver.api.model.ConjoinedState;
import io.nimbusio.webserver.api.model.PaginatedList;
import io.nimbusio.webserver.api.model.exceptions.ConjoinedConflictException;
import io.nimbusio.webserver.api.model.exceptions.NoSuchConjoinedException;
import io.nimbusio.webserver.api.model.exceptions.NoSuchKeyException;
import io.vertx.core.buffer.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ConjoinedArchiveManagerTest {

    private final BackendFixture fixture = new BackendFixture(4, 16);
    private final Collection collection = fixture.metadataClient.createCollection("photos", "alice", false, null);
    private final ConjoinedArchiveManager manager = fixture.conjoinedArchiveManager;

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private ConjoinedState state(String conjoinedIdentifier) {
        return fixture.archiveStore.get(fixture.identifierTranslator.internalId(conjoinedIdentifier))
                .map(ConjoinedArchive::getState)
                .get();
    }

    @Test
    void startCreatesAnActiveArchive() {
        final ConjoinedEntry entry = manager.start(collection, "big.bin");

        Assertions.assertEquals("big.bin", entry.getKey());
        Assertions.assertEquals(BackendFixture.NOW, entry.getCreateTime());
        Assertions.assertNull(entry.getCompleteTime());
        Assertions.assertNull(entry.getAbortTime());
        Assertions.assertEquals(ConjoinedState.ACTIVE, state(entry.getConjoinedIdentifier()));
    }

    @Test
    void finishCompletesTheArchive() {
        final String id = manager.start(collection, "big.bin").getConjoinedIdentifier();

        final ConjoinedEntry finished = manager.finish(collection, "big.bin", id);

        Assertions.assertEquals(BackendFixture.NOW, finished.getCompleteTime());
        Assertions.assertEquals(ConjoinedState.COMPLETED, state(id));
        Assertions.assertEquals(0, fixture.retrievalEngine.getMetadata(collection, "big.bin", null).getTotalSize());
    }

    /**
     * Only an active archive can be finished or aborted, and only once.
     */
    @Test
    void terminalArchivesCannotTransitionAgain() {
        final String finished = manager.start(collection, "a").getConjoinedIdentifier();
        manager.finish(collection, "a", finished);
        Assertions.assertThrows(ConjoinedConflictException.class, () -> manager.finish(collection, "a", finished));
        Assertions.assertThrows(ConjoinedConflictException.class, () -> manager.abort(collection, "a", finished));

        final String aborted = manager.start(collection, "b").getConjoinedIdentifier();
        manager.abort(collection, "b", aborted);
        Assertions.assertThrows(ConjoinedConflictException.class, () -> manager.abort(collection, "b", aborted));
        Assertions.assertThrows(ConjoinedConflictException.class, () -> manager.finish(collection, "b", aborted));
    }

    @Test
    void abortDiscardsPartsButKeepsTheArchiveListed() {
        final String id = manager.start(collection, "big.bin").getConjoinedIdentifier();
        fixture.archiveWriter.archive(collection, "big.bin", Buffer.buffer("0123456789"), id, 1);

        final ConjoinedEntry aborted = manager.abort(collection, "big.bin", id);

        Assertions.assertEquals(BackendFixture.NOW, aborted.getAbortTime());
        Assertions.assertEquals(0, fixture.storageClient.getSegmentCount());
        Assertions.assertEquals(10, fixture.accountingClient.getUsage(collection.getId(), "photos")
                .getBytesRemoved());
        Assertions.assertThrows(NoSuchKeyException.class,
                () -> fixture.retrievalEngine.getMetadata(collection, "big.bin", null));

        final PaginatedList<ConjoinedEntry> listed = manager.listArchives(collection, 10, null, null);
        Assertions.assertEquals(1, listed.getItems().size());
        Assertions.assertEquals(id, listed.getItems().get(0).getConjoinedIdentifier());
        Assertions.assertNotNull(listed.getItems().get(0).getAbortTime());
    }

    @Test
    void archivesAreScopedToCollectionAndKey() {
        final String id = manager.start(collection, "big.bin").getConjoinedIdentifier();
        final Collection other = fixture.metadataClient.createCollection("music", "bob", false, null);

        Assertions.assertThrows(NoSuchConjoinedException.class, () -> manager.finish(collection, "other", id));
        Assertions.assertThrows(NoSuchConjoinedException.class, () -> manager.finish(other, "big.bin", id));
    }

    @Test
    void listingIsPaginated() {
        final List<String> ids = new ArrayList<>();
        for (String key : new String[] {"a", "b", "c"}) {
            ids.add(manager.start(collection, key).getConjoinedIdentifier());
        }

        final PaginatedList<ConjoinedEntry> first = manager.listArchives(collection, 2, null, null);
        assertThat(first.isTruncated()).isTrue();
        assertThat(first.getItems()).extracting(ConjoinedEntry::getKey).containsExactly("a", "b");

        final ConjoinedEntry last = first.getItems().get(1);
        final PaginatedList<ConjoinedEntry> second = manager.listArchives(collection, 2, last.getKey(),
                last.getConjoinedIdentifier());
        assertThat(second.isTruncated()).isFalse();
        assertThat(second.getItems()).extracting(ConjoinedEntry::getConjoinedIdentifier).containsExactly(ids.get(2));
    }

    @Test
    void uploadsAreListedInPartOrder() {
        final String id = manager.start(collection, "big.bin").getConjoinedIdentifier();
        fixture.archiveWriter.archive(collection, "big.bin", Buffer.buffer("ccc"), id, 3);
        fixture.archiveWriter.archive(collection, "big.bin", Buffer.buffer("a"), id, 1);
        fixture.archiveWriter.archive(collection, "big.bin", Buffer.buffer("bb"), id, 2);

        final PaginatedList<ConjoinedPart> parts = manager.listUploadsInArchive(collection, "big.bin", id, 2);

        assertThat(parts.isTruncated()).isTrue();
        assertThat(parts.getItems()).extracting(ConjoinedPart::getPartNumber).containsExactly(1, 2);
        assertThat(parts.getItems()).extracting(ConjoinedPart::getSize).containsExactly(1L, 2L);
    }

    /**
     * When finish and abort race on one archive, exactly one of them wins.
     */
    @Test
    void racingFinishAndAbortHaveOneWinner() throws Exception {
        final ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 20; i++) {
                final String key = "race-" + i;
                final String id = manager.start(collection, key).getConjoinedIdentifier();
                final CountDownLatch go = new CountDownLatch(1);
                final Future<ConjoinedEntry> finish = executor.submit(gated(go,
                        () -> manager.finish(collection, key, id)));
                final Future<ConjoinedEntry> abort = executor.submit(gated(go,
                        () -> manager.abort(collection, key, id)));
                go.countDown();

                final boolean finished = succeeded(finish);
                final boolean aborted = succeeded(abort);
                Assertions.assertTrue(finished ^ aborted, "exactly one transition should win for " + key);
                Assertions.assertEquals(finished ? ConjoinedState.COMPLETED : ConjoinedState.ABORTED, state(id));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * A finish that lands between the active check of a part upload and the insert of the part rejects the part, and
     * the part's segments are deleted without being accounted.
     */
    @Test
    void partsLandingAfterFinishAreRejected() {
        final AtomicReference<Runnable> beforeAdd = new AtomicReference<>(() -> { });
        final InMemoryConjoinedArchiveStore store = new InMemoryConjoinedArchiveStore() {
            @Override
            public AddPartResult addPart(UnifiedId unifiedId, ConjoinedPart part) {
                beforeAdd.getAndSet(() -> { }).run();
                return super.addPart(unifiedId, part);
            }
        };
        final ConjoinedArchiveManager racingManager = new ConjoinedArchiveManager(store, fixture.metadataClient,
                fixture.storageClient, fixture.accountingClient, fixture.idFactory, fixture.identifierTranslator,
                fixture.dependencyCaller, fixture.clock);
        final ArchiveWriter writer = new ArchiveWriter(fixture.metadataClient, fixture.storageClient,
                fixture.accountingClient, racingManager, fixture.idFactory, fixture.identifierTranslator,
                fixture.dependencyCaller, 4, fixture.clock);

        final String id = racingManager.start(collection, "big.bin").getConjoinedIdentifier();
        beforeAdd.set(() -> racingManager.finish(collection, "big.bin", id));

        Assertions.assertThrows(ConjoinedConflictException.class,
                () -> writer.archive(collection, "big.bin", Buffer.buffer("late"), id, 1));

        final UnifiedId internal = fixture.identifierTranslator.internalId(id);
        Assertions.assertEquals(ConjoinedState.COMPLETED, store.get(internal).get().getState());
        Assertions.assertTrue(store.getParts(internal).isEmpty());
        Assertions.assertEquals(0, fixture.storageClient.getSegmentCount());
        Assertions.assertEquals(0, fixture.accountingClient.getUsage(collection.getId(), "photos").getBytesAdded());
    }

    /**
     * A part uploaded while the archive is being finished is either part of the published version or rejected.
     */
    @Test
    void racingPartsAndFinishNeverOrphanParts() throws Exception {
        final ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            int published = 0;
            for (int i = 0; i < 20; i++) {
                final String key = "race-" + i;
                final String id = manager.start(collection, key).getConjoinedIdentifier();
                final CountDownLatch go = new CountDownLatch(1);
                final Future<String> part = executor.submit(gated(go,
                        () -> fixture.archiveWriter.archive(collection, key, Buffer.buffer("data"), id, 1)));
                final Future<ConjoinedEntry> finish = executor.submit(gated(go,
                        () -> manager.finish(collection, key, id)));
                go.countDown();

                finish.get(10, TimeUnit.SECONDS);
                final boolean added = succeeded(part);
                final UnifiedId internal = fixture.identifierTranslator.internalId(id);
                Assertions.assertTrue(fixture.archiveStore.getParts(internal).isEmpty(), "orphaned part for " + key);
                Assertions.assertEquals(added ? 4 : 0,
                        fixture.metadataClient.getVersion(collection.getId(), internal).get().getSize());
                if (added) {
                    published++;
                }
            }
            Assertions.assertEquals(published, fixture.storageClient.getSegmentCount());
            Assertions.assertEquals(4L * published,
                    fixture.accountingClient.getUsage(collection.getId(), "photos").getBytesAdded());
        } finally {
            executor.shutdownNow();
        }
    }

    private static <T> Callable<T> gated(CountDownLatch go, Callable<T> callable) {
        return () -> {
            go.await();
            return callable.call();
        };
    }

    private static boolean succeeded(Future<?> future) throws Exception {
        try {
            future.get(10, TimeUnit.SECONDS);
            return true;
        } catch (ExecutionException e) {
            Assertions.assertTrue(e.getCause() instanceof ConjoinedConflictException, e.getCause().toString());
            return false;
        }
    }
}
