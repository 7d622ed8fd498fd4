package io.nimbusio.webserver.api.auth;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import io.nimbusio.webserver.api.common.ErrorCode;
import io.nimbusio.webserver.api.common.HttpException;
import io.nimbusio.webserver.api.model.Collection;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * The outcome of authorizing a request. Callers must check {@link #isGranted()} (or call
 * {@link #checkGranted(String)}) before acting on the request.
 */
public final class AuthorizationResult {

    public enum Status {
        GRANTED,
        NOT_AUTHENTICATED,
        FORBIDDEN
    }

    private final Status status;
    @Nullable
    private final Collection collection;
    private final String reason;

    private AuthorizationResult(Status status, @Nullable Collection collection, String reason) {
        this.status = status;
        this.collection = collection;
        this.reason = reason;
    }

    public static AuthorizationResult granted(@Nullable Collection collection, String reason) {
        return new AuthorizationResult(Status.GRANTED, collection, reason);
    }

    public static AuthorizationResult notAuthenticated(Collection collection, String reason) {
        return new AuthorizationResult(Status.NOT_AUTHENTICATED, collection, reason);
    }

    public static AuthorizationResult forbidden(Collection collection, String reason) {
        return new AuthorizationResult(Status.FORBIDDEN, collection, reason);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isGranted() {
        return status == Status.GRANTED;
    }

    /**
     * The collection the request addressed; absent for requests that need no access.
     */
    public Optional<Collection> getCollection() {
        return Optional.ofNullable(collection);
    }

    public String getReason() {
        return reason;
    }

    /**
     * @return the authorized collection
     * @throws HttpException with a 401 or 403 error code if access was not granted
     */
    public Collection checkGranted(String path) {
        switch (status) {
            case GRANTED:
                Preconditions.checkState(collection != null, "no collection was authorized");
                return collection;
            case NOT_AUTHENTICATED:
                throw new HttpException(ErrorCode.NOT_AUTHENTICATED, "Authentication required", path);
            case FORBIDDEN:
                throw new HttpException(ErrorCode.FORBIDDEN, "Access denied", path);
            default:
                throw new IllegalStateException("Unknown authorization status " + status);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("status", status)
                .add("collection", collection == null ? null : collection.getName())
                .add("reason", reason)
                .toString();
    }
}
