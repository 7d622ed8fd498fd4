package io.nimbusio.webserver.api.common;

import com.codahale.metrics.Meter;
import io.vertx.core.Handler;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Operations that need to be done for every single request, period.
 *
 * Assigns a request ID (logged through the MDC and returned in a response header), counts the request and makes
 * sure every response that is not a streamed object body carries "Connection: close".
 */
public class CommonHandler implements Handler<RoutingContext> {

    public static final String REQUEST_ID_MDC = "requestId";

    /**
     * Handlers that stream an object body put {@code true} under this key before writing headers.
     */
    public static final String STREAMING_RESPONSE_KEY = "nimbus.streamingResponse";

    private final Meter requestMeter;

    public CommonHandler(Meter requestMeter) {
        this.requestMeter = requestMeter;
    }

    @Override
    public void handle(RoutingContext routingContext) {
        final HttpServerResponse response = routingContext.response();
        final String requestId = UUID.randomUUID().toString();

        requestMeter.mark();

        routingContext.addHeadersEndHandler(v -> {
            response.putHeader(CommonHeaders.REQUEST_ID, requestId);
            if (!isStreamingResponse(routingContext)) {
                response.putHeader(HttpHeaders.CONNECTION, "close");
            }
        });

        MDC.put(REQUEST_ID_MDC, requestId);
        try {
            routingContext.next();
        } finally {
            MDC.remove(REQUEST_ID_MDC);
        }
    }

    public static void markStreamingResponse(RoutingContext routingContext) {
        routingContext.put(STREAMING_RESPONSE_KEY, Boolean.TRUE);
    }

    private static boolean isStreamingResponse(RoutingContext routingContext) {
        return Boolean.TRUE.equals(routingContext.get(STREAMING_RESPONSE_KEY));
    }
}
