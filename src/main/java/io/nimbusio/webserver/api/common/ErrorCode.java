package io.nimbusio.webserver.api.common;

/**
 * Error codes returned in the body of error responses, with the HTTP status each one is sent with.
 *
 * The read service reports malformed Range headers, HTTP dates and identifiers with a 503 status, the same class as
 * a dependency hiccup. Clients of that service rely on this, so keep it.
 */
public enum ErrorCode {
    UNPARSABLE_REQUEST(HttpResponseStatus.BAD_REQUEST, "UnparsableRequest"),
    INVALID_REQUESTER_ADDRESS(HttpResponseStatus.BAD_REQUEST, "InvalidRequesterAddress"),
    INVALID_REFERER(HttpResponseStatus.BAD_REQUEST, "InvalidReferer"),
    INVALID_PARAMETER(HttpResponseStatus.BAD_REQUEST, "InvalidParameter"),
    NOT_AUTHENTICATED(HttpResponseStatus.UNAUTHORIZED, "NotAuthenticated"),
    FORBIDDEN(HttpResponseStatus.FORBIDDEN, "Forbidden"),
    NOT_FOUND(HttpResponseStatus.NOT_FOUND, "NotFound"),
    NO_SUCH_COLLECTION(HttpResponseStatus.NOT_FOUND, "CollectionNotFound"),
    NO_SUCH_KEY(HttpResponseStatus.NOT_FOUND, "KeyNotFound"),
    NO_SUCH_CONJOINED(HttpResponseStatus.NOT_FOUND, "ConjoinedNotFound"),
    METHOD_NOT_ALLOWED(HttpResponseStatus.METHOD_NOT_ALLOWED, "MethodNotAllowed"),
    CONFLICT(HttpResponseStatus.CONFLICT, "Conflict"),
    REQUEST_TOO_LARGE(HttpResponseStatus.REQUEST_ENTITY_TOO_LARGE, "RequestEntityTooLarge"),
    RANGE_NOT_SATISFIABLE(HttpResponseStatus.REQUESTED_RANGE_NOT_SATISFIABLE, "RangeNotSatisfiable"),
    MALFORMED_RANGE(HttpResponseStatus.SERVICE_UNAVAILABLE, "MalformedRange"),
    MALFORMED_TIMESTAMP(HttpResponseStatus.SERVICE_UNAVAILABLE, "MalformedTimestamp"),
    MALFORMED_IDENTIFIER(HttpResponseStatus.SERVICE_UNAVAILABLE, "MalformedIdentifier"),
    SERVICE_UNAVAILABLE(HttpResponseStatus.SERVICE_UNAVAILABLE, "ServiceUnavailable"),
    DEPENDENCY_FAILURE(HttpResponseStatus.INTERNAL_SERVER_ERROR, "DependencyFailure"),
    INTERNAL_SERVER_ERROR(HttpResponseStatus.INTERNAL_SERVER_ERROR, "InternalServerError");

    private final int statusCode;
    private final String errorName;

    ErrorCode(int statusCode, String errorName) {
        this.statusCode = statusCode;
        this.errorName = errorName;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorName() {
        return errorName;
    }

    /**
     * The code used when a request is failed with a bare status code and no exception (for example by the Vert.x body
     * handler).
     */
    public static ErrorCode forStatusCode(int statusCode) {
        switch (statusCode) {
            case HttpResponseStatus.BAD_REQUEST:
                return UNPARSABLE_REQUEST;
            case HttpResponseStatus.NOT_FOUND:
                return NOT_FOUND;
            case HttpResponseStatus.METHOD_NOT_ALLOWED:
                return METHOD_NOT_ALLOWED;
            case HttpResponseStatus.REQUEST_ENTITY_TOO_LARGE:
                return REQUEST_TOO_LARGE;
            default:
                return INTERNAL_SERVER_ERROR;
        }
    }
}
