package io.nimbusio.webserver.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import javax.annotation.Nullable;
import java.time.Instant;

/**
 * A conjoined archive as shown to clients: the archive identifier is the public one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ConjoinedEntry {

    private final String conjoinedIdentifier;
    private final String key;
    private final Instant createTime;
    @Nullable
    private final Instant abortTime;
    @Nullable
    private final Instant completeTime;

    public ConjoinedEntry(String conjoinedIdentifier,
                          String key,
                          Instant createTime,
                          @Nullable Instant abortTime,
                          @Nullable Instant completeTime) {
        this.conjoinedIdentifier = Preconditions.checkNotNull(conjoinedIdentifier);
        this.key = Preconditions.checkNotNull(key);
        this.createTime = Preconditions.checkNotNull(createTime);
        this.abortTime = abortTime;
        this.completeTime = completeTime;
    }

    public static ConjoinedEntry of(ConjoinedArchive archive, String conjoinedIdentifier) {
        return new ConjoinedEntry(conjoinedIdentifier, archive.getKey(), archive.getCreateTime(),
                archive.getAbortTime().orElse(null), archive.getCompleteTime().orElse(null));
    }

    @JsonProperty("conjoined_identifier")
    public String getConjoinedIdentifier() {
        return conjoinedIdentifier;
    }

    @JsonProperty("key")
    public String getKey() {
        return key;
    }

    @JsonProperty("create_timestamp")
    public Instant getCreateTime() {
        return createTime;
    }

    @JsonProperty("abort_timestamp")
    @Nullable
    public Instant getAbortTime() {
        return abortTime;
    }

    @JsonProperty("complete_timestamp")
    @Nullable
    public Instant getCompleteTime() {
        return completeTime;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("conjoinedIdentifier", conjoinedIdentifier)
                .add("key", key)
                .add("createTime", createTime)
                .add("abortTime", abortTime)
                .add("completeTime", completeTime)
                .toString();
    }
}
