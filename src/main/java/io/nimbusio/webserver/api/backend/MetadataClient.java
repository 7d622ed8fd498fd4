package io.nimbusio.webserver.api.backend;

import io.nimbusio.webserver.api.ids.UnifiedId;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.api.model.KeyListing;
import io.nimbusio.webserver.api.model.ObjectVersion;
import io.nimbusio.webserver.api.model.SegmentStatus;
import io.nimbusio.webserver.api.model.VersionStatus;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;

/**
 * Client for the cluster metadata database.
 *
 * All methods block, and are called through a {@link DependencyCaller}.
 */
public interface MetadataClient {

    Optional<Collection> getCollection(String name);

    /**
     * The newest LIVE version of a key.
     */
    Optional<ObjectVersion> getLiveVersion(long collectionId, String key);

    Optional<ObjectVersion> getVersion(long collectionId, UnifiedId versionId);

    /**
     * Every version of a key, in version order, whatever its status.
     */
    List<ObjectVersion> getVersions(long collectionId, String key);

    /**
     * The status rows written by the storage nodes for the segments of a version, in sequence order.
     */
    List<SegmentStatus> getSegmentStatus(long collectionId, UnifiedId versionId);

    void putVersion(ObjectVersion version);

    void putSegmentStatus(long collectionId, UnifiedId versionId, List<SegmentStatus> statusRows);

    void updateStatus(long collectionId, UnifiedId versionId, VersionStatus status);

    /**
     * Remove a version and its status rows.
     */
    void removeVersion(long collectionId, UnifiedId versionId);

    /**
     * List the LIVE keys of a collection in key order.
     *
     * @param prefix    only keys starting with this prefix
     * @param marker    only keys strictly after this key, if not null
     * @param delimiter if not null, keys containing the delimiter after the prefix are rolled up into a common prefix
     * @param maxKeys   the maximum number of keys plus prefixes returned
     */
    KeyListing listKeys(long collectionId,
                        String prefix,
                        @Nullable String marker,
                        @Nullable String delimiter,
                        int maxKeys);

    /**
     * List the versions of the keys of a collection, ordered by key then version, skipping tombstones.
     *
     * Fetches at most {@code limit} versions strictly after the (keyMarker, versionMarker) position.
     */
    List<ObjectVersion> listVersions(long collectionId,
                                     String prefix,
                                     @Nullable String keyMarker,
                                     @Nullable UnifiedId versionMarker,
                                     int limit);
}
