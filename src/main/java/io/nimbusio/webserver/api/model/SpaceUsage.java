package io.nimbusio.webserver.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Space accounting totals for one collection.
 */
public final class SpaceUsage {

    private final String collection;
    private final long bytesAdded;
    private final long bytesRemoved;
    private final long bytesRetrieved;

    @JsonCreator
    public SpaceUsage(@JsonProperty("collection") String collection,
                      @JsonProperty("bytes_added") long bytesAdded,
                      @JsonProperty("bytes_removed") long bytesRemoved,
                      @JsonProperty("bytes_retrieved") long bytesRetrieved) {
        this.collection = collection;
        this.bytesAdded = bytesAdded;
        this.bytesRemoved = bytesRemoved;
        this.bytesRetrieved = bytesRetrieved;
    }

    @JsonProperty("collection")
    public String getCollection() {
        return collection;
    }

    @JsonProperty("bytes_added")
    public long getBytesAdded() {
        return bytesAdded;
    }

    @JsonProperty("bytes_removed")
    public long getBytesRemoved() {
        return bytesRemoved;
    }

    @JsonProperty("bytes_retrieved")
    public long getBytesRetrieved() {
        return bytesRetrieved;
    }

    @JsonProperty("bytes_stored")
    public long getBytesStored() {
        return bytesAdded - bytesRemoved;
    }
}
