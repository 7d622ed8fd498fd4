package io.nimbusio.webserver.api.read;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.nimbusio.webserver.api.model.ObjectMetadata;

import java.time.Instant;

/**
 * The JSON body of a metadata request.
 */
final class MetadataResponse {

    private final ObjectMetadata metadata;

    MetadataResponse(ObjectMetadata metadata) {
        this.metadata = metadata;
    }

    @JsonProperty("key")
    public String getKey() {
        return metadata.getKey();
    }

    @JsonProperty("version_identifier")
    public String getVersionIdentifier() {
        return metadata.getVersionIdentifier();
    }

    @JsonProperty("content_type")
    public String getContentType() {
        return metadata.getContentType();
    }

    @JsonProperty("total_size")
    public long getTotalSize() {
        return metadata.getTotalSize();
    }

    @JsonProperty("last_modified")
    public Instant getLastModified() {
        return metadata.getLastModified();
    }
}
