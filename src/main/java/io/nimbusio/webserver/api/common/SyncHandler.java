package io.nimbusio.webserver.api.common;

import io.nimbusio.webserver.util.VertxUtil;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;

/**
 * A Vert.x handler that runs entirely on a single worker thread.
 *
 * This handler is meant for requests that require processing that would otherwise block the event loop, such as
 * calls to the metadata or accounting services. Requests with a body must have it read (by a BodyHandler) before this
 * handler runs.
 *
 * Classes extending it are free to make synchronous, blocking, API calls. It is asynchronous from the perspective of
 * the event loop; {@link VertxUtil#runAsync} returns immediately.
 */
public abstract class SyncHandler implements Handler<RoutingContext> {
    @Override
    public void handle(RoutingContext context) {
        VertxUtil.runAsync(context.vertx(), () -> handleSync(context))
                .exceptionally(throwable -> {
                    context.fail(throwable);
                    return null;
                });
    }

    public abstract void handleSync(RoutingContext context);
}
