package io.nimbusio.webserver.api.write;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * A parsed write request.
 */
public final class WriteRequest {

    private final RequestKind kind;
    @Nullable
    private final String collectionName;
    @Nullable
    private final String key;
    @Nullable
    private final String versionIdentifier;
    @Nullable
    private final String conjoinedIdentifier;
    @Nullable
    private final Integer conjoinedPart;

    public WriteRequest(RequestKind kind,
                        @Nullable String collectionName,
                        @Nullable String key,
                        @Nullable String versionIdentifier,
                        @Nullable String conjoinedIdentifier,
                        @Nullable Integer conjoinedPart) {
        this.kind = Preconditions.checkNotNull(kind);
        this.collectionName = collectionName;
        this.key = key;
        this.versionIdentifier = versionIdentifier;
        this.conjoinedIdentifier = conjoinedIdentifier;
        this.conjoinedPart = conjoinedPart;
    }

    public RequestKind getKind() {
        return kind;
    }

    public Optional<String> getCollectionName() {
        return Optional.ofNullable(collectionName);
    }

    /**
     * @throws IllegalStateException for requests that do not address a key
     */
    public String getKey() {
        Preconditions.checkState(key != null, "%s requests have no key", kind);
        return key;
    }

    @Nullable
    public String getVersionIdentifier() {
        return versionIdentifier;
    }

    @Nullable
    public String getConjoinedIdentifier() {
        return conjoinedIdentifier;
    }

    @Nullable
    public Integer getConjoinedPart() {
        return conjoinedPart;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("kind", kind)
                .add("collectionName", collectionName)
                .add("key", key)
                .add("versionIdentifier", versionIdentifier)
                .add("conjoinedIdentifier", conjoinedIdentifier)
                .add("conjoinedPart", conjoinedPart)
                .toString();
    }
}
