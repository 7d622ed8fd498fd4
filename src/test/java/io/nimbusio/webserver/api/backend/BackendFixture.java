package io.nimbusio.webserver.api.backend;

import io.nimbusio.webserver.api.eventing.EventPublisher;
import io.nimbusio.webserver.api.ids.IdentifierTranslator;
import io.nimbusio.webserver.api.ids.UnifiedIdFactory;
import io.nimbusio.webserver.api.memory.InMemoryConjoinedArchiveStore;
import io.nimbusio.webserver.api.memory.InMemoryMetadataClient;
import io.nimbusio.webserver.api.memory.InMemorySpaceAccountingClient;
import io.nimbusio.webserver.api.memory.InMemoryStorageClient;
import io.nimbusio.webserver.config.IdentifierKeysConfiguration;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * The backend wired to in-memory collaborators, with a fixed clock and a mock event publisher.
 */
final class BackendFixture implements AutoCloseable {

    static final Instant NOW = Instant.parse("2021-03-04T05:06:07Z");

    final InMemoryMetadataClient metadataClient = new InMemoryMetadataClient();
    final InMemoryStorageClient storageClient = new InMemoryStorageClient();
    final InMemorySpaceAccountingClient accountingClient = new InMemorySpaceAccountingClient();
    final InMemoryConjoinedArchiveStore archiveStore = new InMemoryConjoinedArchiveStore();
    final DependencyCaller dependencyCaller = new DependencyCaller(Duration.ofSeconds(5), 4, 16);
    final UnifiedIdFactory idFactory = new UnifiedIdFactory(3);
    final IdentifierTranslator identifierTranslator = IdentifierTranslator.fromConfiguration(
            new IdentifierKeysConfiguration("2b7e151628aed2a6abf7158809cf4f3c", "00112233445566778899", 16));
    final EventPublisher eventPublisher = Mockito.mock(EventPublisher.class);
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    final ConjoinedArchiveManager conjoinedArchiveManager;
    final ArchiveWriter archiveWriter;
    final RetrievalEngine retrievalEngine;

    BackendFixture(int segmentSize, int chunkSize) {
        conjoinedArchiveManager = new ConjoinedArchiveManager(archiveStore, metadataClient, storageClient,
                accountingClient, idFactory, identifierTranslator, dependencyCaller, clock);
        archiveWriter = new ArchiveWriter(metadataClient, storageClient, accountingClient, conjoinedArchiveManager,
                idFactory, identifierTranslator, dependencyCaller, segmentSize, clock);
        retrievalEngine = new RetrievalEngine(metadataClient, storageClient, accountingClient, identifierTranslator,
                dependencyCaller, eventPublisher, chunkSize);
    }

    @Override
    public void close() {
        dependencyCaller.close();
    }
}
