package io.nimbusio.webserver.api.backend;

import io.nimbusio.webserver.api.ids.UnifiedId;
import io.nimbusio.webserver.api.model.ObjectVersion;
import io.nimbusio.webserver.api.model.VersionStatus;

/**
 * Keeps a single live version per key in collections without versioning.
 */
final class VersionSupersession {

    private VersionSupersession() {

    }

    static void supersedeOlderVersions(MetadataClient metadataClient, long collectionId, String key, UnifiedId current) {
        for (ObjectVersion version : metadataClient.getVersions(collectionId, key)) {
            if (version.getStatus() == VersionStatus.LIVE && version.getVersionId().compareTo(current) < 0) {
                metadataClient.updateStatus(collectionId, version.getVersionId(), VersionStatus.SUPERSEDED);
            }
        }
    }
}
