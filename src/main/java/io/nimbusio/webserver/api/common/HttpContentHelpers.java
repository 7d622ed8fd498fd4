package io.nimbusio.webserver.api.common;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.net.HttpHeaders;
import io.nimbusio.webserver.api.model.ByteRange;
import io.nimbusio.webserver.api.model.ObjectMetadata;
import io.nimbusio.webserver.vertx.AbortableReadStream;
import io.vertx.core.Handler;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.streams.Pump;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Helpers for writing HTTP response headers and bodies.
 */
public final class HttpContentHelpers {

    private static final Logger LOG = LoggerFactory.getLogger(HttpContentHelpers.class);

    private HttpContentHelpers() {

    }

    public static String httpDate(Instant instant) {
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(instant.atZone(ZoneOffset.UTC));
    }

    /**
     * Writes an HTTP response with a serialized JSON object in the body, and ends the response.
     */
    public static <T> void writeJsonResponse(HttpServerRequest request,
                                             HttpServerResponse response,
                                             T content,
                                             ObjectMapper mapper) {
        writeJsonResponse(request, response, HttpResponseStatus.OK, content, mapper);
    }

    public static <T> void writeJsonResponse(HttpServerRequest request,
                                             HttpServerResponse response,
                                             int statusCode,
                                             T content,
                                             ObjectMapper mapper) {
        final String body;
        try {
            body = mapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new HttpException(ErrorCode.INTERNAL_SERVER_ERROR, "Internal server error", request.path(), e);
        }
        response.setStatusCode(statusCode);
        response.putHeader(HttpHeaders.CONTENT_TYPE, ContentType.APPLICATION_JSON);
        response.end(body);
    }

    /**
     * Write the headers that describe an object version: its type, modification time and identifier.
     */
    public static void writeObjectMetadataHeaders(HttpServerResponse response, ObjectMetadata metadata) {
        response.putHeader(HttpHeaders.LAST_MODIFIED, httpDate(metadata.getLastModified()));
        response.putHeader(CommonHeaders.VERSION_IDENTIFIER, metadata.getVersionIdentifier());
    }

    /**
     * Write the status code and headers of a successful GET or HEAD object response.
     */
    public static void writeReadObjectResponseHeadersAndStatus(HttpServerResponse response, ObjectMetadata metadata) {
        writeObjectMetadataHeaders(response, metadata);
        response.putHeader(HttpHeaders.CONTENT_TYPE, metadata.getContentType());
        response.putHeader(HttpHeaders.ACCEPT_RANGES, "bytes");
        response.putHeader(HttpHeaders.CONTENT_LENGTH, Long.toString(metadata.getContentLength()));
        if (metadata.getRange().isPresent()) {
            final ByteRange range = metadata.getRange().get();
            response.setStatusCode(HttpResponseStatus.PARTIAL_CONTENT);
            response.putHeader(HttpHeaders.CONTENT_RANGE,
                    String.format("bytes %d-%d/%d", range.getStart(), range.getEnd(), metadata.getTotalSize()));
        } else {
            response.setStatusCode(HttpResponseStatus.OK);
        }
    }

    /**
     * Pump a stream of object data back to the client.
     *
     * @return a CompletableFuture that is completed, on the event loop, when all the bytes have been pumped or the
     *         request has failed. It is never completed exceptionally: a failure is passed to
     *         {@link RoutingContext#fail(Throwable)}, and the stream is aborted if the client goes away before the
     *         end of the body.
     */
    public static CompletableFuture<Void> pumpResponseContent(RoutingContext context,
                                                              HttpServerResponse response,
                                                              AbortableReadStream<Buffer> stream) {
        final CompletableFuture<Void> cf = new CompletableFuture<>();
        final Pump pump = Pump.pump(stream, response);
        stream.endHandler(x -> {
            response.end();
            cf.complete(null);
        });

        final AtomicBoolean failed = new AtomicBoolean(false);
        final Handler<Throwable> exceptionHandler = ex -> {
            if (!failed.compareAndSet(false, true)) {
                LOG.warn("Re-entered the exception handler while pumping a response", ex);
                return;
            }
            stopPump(pump);
            stream.abort();
            context.fail(ex);
            cf.complete(null);
        };
        stream.exceptionHandler(exceptionHandler);
        response.exceptionHandler(exceptionHandler);
        response.closeHandler(v -> {
            if (!response.ended()) {
                LOG.debug("Client closed the connection before the end of the response");
            }
            stopPump(pump);
            stream.abort();
            cf.complete(null);
        });
        pump.start();
        return cf;
    }

    private static void stopPump(Pump pump) {
        try {
            pump.stop();
        } catch (IllegalStateException ise) {
            LOG.trace("Failed to stop the pump", ise);
        }
    }
}
