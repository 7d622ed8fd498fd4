package io.nimbusio.webserver.server;

import io.nimbusio.webserver.api.auth.CustomerKey;
import io.nimbusio.webserver.api.auth.CustomerKeyStore;
import io.nimbusio.webserver.api.backend.ConjoinedArchiveStore;
import io.nimbusio.webserver.api.backend.MetadataClient;
import io.nimbusio.webserver.api.backend.SpaceAccountingClient;
import io.nimbusio.webserver.api.backend.StorageClient;
import io.nimbusio.webserver.api.memory.InMemoryConjoinedArchiveStore;
import io.nimbusio.webserver.api.memory.InMemoryCustomerKeyStore;
import io.nimbusio.webserver.api.memory.InMemoryMetadataClient;
import io.nimbusio.webserver.api.memory.InMemorySpaceAccountingClient;
import io.nimbusio.webserver.api.memory.InMemoryStorageClient;
import io.nimbusio.webserver.config.CollectionSeed;
import io.nimbusio.webserver.config.CustomerKeySeed;
import io.nimbusio.webserver.config.WebServerConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The collaborators of the web servers: metadata, storage, space accounting and customer keys.
 *
 * All of them are kept in memory and seeded from the configuration at startup.
 */
public final class WebServerClients {

    private static final Logger LOG = LoggerFactory.getLogger(WebServerClients.class);

    private final InMemoryMetadataClient metadataClient;
    private final InMemoryConjoinedArchiveStore conjoinedArchiveStore;
    private final InMemoryStorageClient storageClient;
    private final InMemorySpaceAccountingClient accountingClient;
    private final InMemoryCustomerKeyStore customerKeyStore;

    public WebServerClients(WebServerConfiguration config) {
        metadataClient = new InMemoryMetadataClient();
        conjoinedArchiveStore = new InMemoryConjoinedArchiveStore();
        storageClient = new InMemoryStorageClient();
        accountingClient = new InMemorySpaceAccountingClient();
        customerKeyStore = new InMemoryCustomerKeyStore();

        for (CollectionSeed seed : config.getCollections()) {
            final String accessControl = seed.getAccessControl() == null || seed.getAccessControl().isNull()
                    ? null : seed.getAccessControl().toString();
            metadataClient.createCollection(seed.getName(), seed.getOwner(), seed.isVersioning(), accessControl);
            LOG.info("Created collection {} owned by {}", seed.getName(), seed.getOwner());
        }
        for (CustomerKeySeed seed : config.getCustomerKeys()) {
            customerKeyStore.addKey(new CustomerKey(seed.getOwner(), seed.getKeyId(), seed.getSecret()));
        }
        LOG.info("Loaded {} customer keys", config.getCustomerKeys().size());
    }

    public MetadataClient getMetadataClient() {
        return metadataClient;
    }

    public ConjoinedArchiveStore getConjoinedArchiveStore() {
        return conjoinedArchiveStore;
    }

    public StorageClient getStorageClient() {
        return storageClient;
    }

    public SpaceAccountingClient getAccountingClient() {
        return accountingClient;
    }

    public CustomerKeyStore getCustomerKeyStore() {
        return customerKeyStore;
    }
}
