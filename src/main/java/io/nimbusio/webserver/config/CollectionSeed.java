package io.nimbusio.webserver.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;

/**
 * A collection created at startup by the in-memory metadata client.
 */
public final class CollectionSeed {

    @JsonProperty("name")
    private String name;

    @JsonProperty("owner")
    private String owner;

    @JsonProperty("versioning")
    private boolean versioning;

    @JsonProperty("accessControl")
    @Nullable
    private JsonNode accessControl;

    public String getName() {
        return name;
    }

    public String getOwner() {
        return owner;
    }

    public boolean isVersioning() {
        return versioning;
    }

    @Nullable
    public JsonNode getAccessControl() {
        return accessControl;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("name", name)
                .add("owner", owner)
                .add("versioning", versioning)
                .toString();
    }
}
