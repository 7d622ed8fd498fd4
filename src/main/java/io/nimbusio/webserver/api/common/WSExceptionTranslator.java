package io.nimbusio.webserver.api.common;

import io.vertx.ext.web.RoutingContext;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

public interface WSExceptionTranslator {

    /**
     * Attempt to rewrite the exception that failed the request to something that we can work with for HTTP
     *
     * @param throwable raw throwable that failed the request, possibly wrapped in CompletionExceptions, or null
     * @return an unwrapped throwable, possibly rewritten as an {@link HttpException}; anything else is sent as an
     *         internal server error.
     */
    Throwable rewriteException(RoutingContext context, @Nullable Throwable throwable);

    /**
     * Get the HTTP response status code.
     *
     * @param throwable  unwrapped throwable that failed the request
     */
    int getHttpResponseCode(@Nonnull Throwable throwable);

    /**
     * Get the Content-Type of the response error message.
     */
    String getResponseErrorContentType();

    /**
     * Get the error message that should be returned to the client for this type of exception.
     *
     * Note:  HEAD requests may not return bodies, so this method will not be called for HEAD requests.
     *
     * @param throwable  unwrapped throwable that failed the request
     */
    String getResponseErrorMessage(@Nonnull Throwable throwable);

    /**
     * Write any additional headers that should be included on error responses.
     *
     * @param routingContext  the routing context for the request
     * @param statusCode      the HTTP response status code
     */
    void writeResponseErrorHeaders(@Nonnull RoutingContext routingContext, int statusCode);

    /**
     * Get the error code associated with this exception.
     */
    ErrorCode getErrorCode(@Nonnull Throwable throwable);
}
