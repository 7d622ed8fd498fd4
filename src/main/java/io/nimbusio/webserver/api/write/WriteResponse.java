package io.nimbusio.webserver.api.write;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nullable;

/**
 * The JSON body of successful archive and delete requests.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
final class WriteResponse {

    private final boolean success;
    @Nullable
    private final String versionIdentifier;
    @Nullable
    private final String conjoinedIdentifier;
    @Nullable
    private final Integer conjoinedPart;

    private WriteResponse(@Nullable String versionIdentifier,
                          @Nullable String conjoinedIdentifier,
                          @Nullable Integer conjoinedPart) {
        this.success = true;
        this.versionIdentifier = versionIdentifier;
        this.conjoinedIdentifier = conjoinedIdentifier;
        this.conjoinedPart = conjoinedPart;
    }

    static WriteResponse archived(String versionIdentifier) {
        return new WriteResponse(versionIdentifier, null, null);
    }

    static WriteResponse partArchived(String conjoinedIdentifier, int conjoinedPart) {
        return new WriteResponse(null, conjoinedIdentifier, conjoinedPart);
    }

    static WriteResponse deleted() {
        return new WriteResponse(null, null, null);
    }

    @JsonProperty("success")
    public boolean isSuccess() {
        return success;
    }

    @JsonProperty("version_identifier")
    @Nullable
    public String getVersionIdentifier() {
        return versionIdentifier;
    }

    @JsonProperty("conjoined_identifier")
    @Nullable
    public String getConjoinedIdentifier() {
        return conjoinedIdentifier;
    }

    @JsonProperty("conjoined_part")
    @Nullable
    public Integer getConjoinedPart() {
        return conjoinedPart;
    }
}
