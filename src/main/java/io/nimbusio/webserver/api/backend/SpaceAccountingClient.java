package io.nimbusio.webserver.api.backend;

import io.nimbusio.webserver.api.model.SpaceUsage;

import java.time.Instant;

/**
 * Client for the space accounting service, which keeps per-collection byte counters used for billing.
 */
public interface SpaceAccountingClient {

    void added(long collectionId, Instant when, long bytes);

    void removed(long collectionId, Instant when, long bytes);

    void retrieved(long collectionId, Instant when, long bytes);

    SpaceUsage getUsage(long collectionId, String collectionName);
}
