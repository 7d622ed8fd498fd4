package io.nimbusio.webserver.api.common;

import io.nimbusio.webserver.api.eventing.EventPublisher;
import io.nimbusio.webserver.util.WebServerMetrics;
import io.vertx.core.Context;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * A failure handler for a Vert.x {@link io.vertx.ext.web.Router}.
 * <p>
 * A Vert.x failure handler is installed by calling:
 * <code><pre>
 *     Router router = ...
 *     router.route().failureHandler(new FailureHandler(...));
 * </pre></code>
 * The failure handler's "handle()" method is called whenever a request encounters an exception while being processed.
 * This handler does the following:
 * <ul>
 * <li>Unwraps any CompletionExceptions to get the root cause of the failure.</li>
 * <li>Reports failures that were not anticipated (anything the translator does not turn into an
 * {@link HttpException}) to the {@link EventPublisher}.</li>
 * <li>Checks if the request has ended; if not, it consumes any remaining data for up to the timeout so that the
 * client will receive an HTTP error code instead of a transport error.</li>
 * <li>Calls the given WSExceptionTranslator methods with the exception to build a response, which always carries a
 * "Connection: close" header.</li>
 * </ul>
 * <p>
 * This handler will write out a response and then call ".end()" on the response object.  There is no code path that
 * does not call ".end()", so responses will never hang.
 */
public class FailureHandler implements Handler<RoutingContext> {
    private static final Logger LOG = LoggerFactory.getLogger(FailureHandler.class);

    private final WSExceptionTranslator wsExceptionTranslator;
    private final EventPublisher eventPublisher;
    private final Duration closeTimeout;

    public FailureHandler(WSExceptionTranslator wsExceptionTranslator,
                          EventPublisher eventPublisher,
                          Duration closeTimeout) {
        this.wsExceptionTranslator = wsExceptionTranslator;
        this.eventPublisher = eventPublisher;
        this.closeTimeout = closeTimeout;
    }

    @Override
    public void handle(RoutingContext routingContext) {
        // if it is not running on the event loop thread, let's schedule them to run later to avoid the deadlock
        if (!Context.isOnEventLoopThread()) {
            routingContext.vertx().runOnContext(nothing -> handle(routingContext));
            return;
        }

        final HttpServerRequest request = routingContext.request();
        final HttpServerResponse response = routingContext.response();
        // we are trying to send a response before we've read the entire request
        if (!request.isEnded()) {
            final Vertx vertx = routingContext.vertx();
            final long timeoutID = vertx.setTimer(
                    closeTimeout.toMillis(),
                    ignored -> {
                        LOG.warn("Ignored request bytes because the request failed prematurely.");
                        if (!response.ended()) {
                            terminate(routingContext, request, response);
                        }
                        response.close();
                    });

            // The data handler can't do anything useful with a failed request.
            request.handler(null);
            request.endHandler(v -> {
                vertx.cancelTimer(timeoutID);
                if (!response.ended()) {
                    terminate(routingContext, request, response);
                }
            });
            request.resume();
        } else {
            terminate(routingContext, request, response);
        }
    }

    /**
     * Actually terminate the request.
     */
    private void terminate(RoutingContext routingContext, HttpServerRequest request, HttpServerResponse response) {
        final Throwable throwable = routingContext.failure();
        final Throwable rootCause = wsExceptionTranslator.rewriteException(routingContext, throwable);

        if (throwable == null) {
            LOG.trace("RoutingContext's failure was null with status code {}.", routingContext.statusCode());
        } else {
            LOG.trace(ExceptionUtils.getStackTrace(throwable));
        }

        if (!(rootCause instanceof HttpException)) {
            eventPublisher.exception("unhandled-request-failure", rootCause);
        }

        if (response.headWritten()) {
            LOG.debug("The response has already been written while trying to write an error out", throwable);
            // Headers and part of the body are already on the wire, the only way to signal the failure is to reset
            // the connection.
            if (!response.ended()) {
                response.close();
            }
            return;
        }

        final int statusCode = wsExceptionTranslator.getHttpResponseCode(rootCause);
        response.setStatusCode(statusCode);
        response.putHeader(HttpHeaders.CONNECTION, "close");

        wsExceptionTranslator.writeResponseErrorHeaders(routingContext, statusCode);

        if (request.method() != HttpMethod.HEAD) {
            final String responseErrorContentType = wsExceptionTranslator.getResponseErrorContentType();
            response
                .putHeader(HttpHeaders.CONTENT_TYPE, responseErrorContentType)
                .headers().remove(HttpHeaders.CONTENT_LENGTH);
            response.end(wsExceptionTranslator.getResponseErrorMessage(rootCause));
        } else {
            response.headers().remove(HttpHeaders.CONTENT_LENGTH);
            response.end();
        }

        if (HttpResponseStatus.isServerError(statusCode)) {
            WebServerMetrics.SERVER_ERRORS.mark();
            LOG.error("Returned a server error", rootCause);
        } else if (HttpResponseStatus.isClientError(statusCode)) {
            WebServerMetrics.CLIENT_ERRORS.mark();
            LOG.debug("Returning error response", rootCause);
        } else {
            LOG.error("Returned an error response with non-error status code:  " + statusCode, throwable);
        }
    }
}
