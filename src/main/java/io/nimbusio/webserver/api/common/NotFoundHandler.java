package io.nimbusio.webserver.api.common;

import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;

/**
 * A handler meant to be used as the last handler in a router chain, that throws an HttpException if no routes
 * matched.
 */
public class NotFoundHandler implements Handler<RoutingContext> {

    @Override
    public void handle(RoutingContext context) {
        throw new HttpException(ErrorCode.NOT_FOUND, "Not Found", context.request().path());
    }
}
