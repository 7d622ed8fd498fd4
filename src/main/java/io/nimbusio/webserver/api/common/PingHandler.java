package io.nimbusio.webserver.api.common;

import io.vertx.core.Handler;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.RoutingContext;

/**
 * Answers liveness checks. Needs no access to any collection.
 */
public class PingHandler implements Handler<RoutingContext> {

    @Override
    public void handle(RoutingContext context) {
        context.response()
                .putHeader(HttpHeaders.CONTENT_TYPE, ContentType.TEXT_PLAIN)
                .end("ok");
    }
}
