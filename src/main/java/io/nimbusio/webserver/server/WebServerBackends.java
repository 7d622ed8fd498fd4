package io.nimbusio.webserver.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nimbusio.webserver.api.auth.AccessControlEvaluator;
import io.nimbusio.webserver.api.auth.AccessControlParser;
import io.nimbusio.webserver.api.auth.AuthorizationGate;
import io.nimbusio.webserver.api.auth.SignatureAuthenticator;
import io.nimbusio.webserver.api.backend.ArchiveWriter;
import io.nimbusio.webserver.api.backend.ConjoinedArchiveManager;
import io.nimbusio.webserver.api.backend.DependencyCaller;
import io.nimbusio.webserver.api.backend.ListingBackend;
import io.nimbusio.webserver.api.backend.RetrievalEngine;
import io.nimbusio.webserver.api.eventing.EventPublisher;
import io.nimbusio.webserver.api.ids.IdentifierTranslator;
import io.nimbusio.webserver.api.ids.UnifiedIdFactory;
import io.nimbusio.webserver.config.WebServerConfiguration;

import java.time.Clock;

/**
 * The backends shared by the read and write APIs.
 */
public final class WebServerBackends {

    private final DependencyCaller dependencyCaller;
    private final UnifiedIdFactory idFactory;
    private final AuthorizationGate authorizationGate;
    private final RetrievalEngine retrievalEngine;
    private final ConjoinedArchiveManager conjoinedArchiveManager;
    private final ArchiveWriter archiveWriter;
    private final ListingBackend listingBackend;

    public WebServerBackends(WebServerConfiguration config,
                             WebServerClients clients,
                             EventPublisher eventPublisher,
                             ObjectMapper mapper,
                             Clock clock) {
        dependencyCaller = new DependencyCaller(config.getDependencyTimeout(), config.getDependencyPoolSize(),
                config.getDependencyQueueSize());
        idFactory = new UnifiedIdFactory(config.getShardId());
        final IdentifierTranslator translator = IdentifierTranslator.fromConfiguration(config.getIdentifierKeys());

        authorizationGate = new AuthorizationGate(clients.getMetadataClient(), dependencyCaller,
                new AccessControlParser(mapper), new AccessControlEvaluator(),
                new SignatureAuthenticator(clients.getCustomerKeyStore(), dependencyCaller, clock,
                        config.getMaxClockSkew()));
        retrievalEngine = new RetrievalEngine(clients.getMetadataClient(), clients.getStorageClient(),
                clients.getAccountingClient(), translator, dependencyCaller, eventPublisher, config.getChunkSize());
        conjoinedArchiveManager = new ConjoinedArchiveManager(clients.getConjoinedArchiveStore(),
                clients.getMetadataClient(), clients.getStorageClient(), clients.getAccountingClient(), idFactory,
                translator, dependencyCaller, clock);
        archiveWriter = new ArchiveWriter(clients.getMetadataClient(), clients.getStorageClient(),
                clients.getAccountingClient(), conjoinedArchiveManager, idFactory, translator, dependencyCaller,
                config.getSegmentSize(), clock);
        listingBackend = new ListingBackend(clients.getMetadataClient(), clients.getAccountingClient(), translator,
                dependencyCaller);
    }

    public UnifiedIdFactory getIdFactory() {
        return idFactory;
    }

    public AuthorizationGate getAuthorizationGate() {
        return authorizationGate;
    }

    public RetrievalEngine getRetrievalEngine() {
        return retrievalEngine;
    }

    public ConjoinedArchiveManager getConjoinedArchiveManager() {
        return conjoinedArchiveManager;
    }

    public ArchiveWriter getArchiveWriter() {
        return archiveWriter;
    }

    public ListingBackend getListingBackend() {
        return listingBackend;
    }

    public void close() {
        dependencyCaller.close();
    }
}
