package io.nimbusio.webserver.api.model;

/**
 * Lifecycle of an {@link ObjectVersion}.
 */
public enum VersionStatus {
    /**
     * Readable, and the current version of its key unless a newer live version exists.
     */
    LIVE,
    /**
     * Owned by an active conjoined archive; not readable until the archive is finished.
     */
    PENDING,
    /**
     * Deleted by the client.
     */
    TOMBSTONE,
    /**
     * Replaced by a newer version in a collection without versioning.
     */
    SUPERSEDED
}
