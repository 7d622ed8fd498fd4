package io.nimbusio.webserver.api.common;

import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;

import java.util.concurrent.CompletableFuture;

/**
 * A Vert.x {@link Handler} that returns a {@link CompletableFuture}.
 *
 * Exceptions passed through the returned future are routed to the failure handler of the router.
 *
 * Extend this class and implement {@link #handleCompletably(RoutingContext)} when the handler needs to do work on the
 * event loop, e.g. pumping data from one stream to another.
 */
public abstract class CompletableHandler implements Handler<RoutingContext> {
    @Override
    public final void handle(RoutingContext context) {
        final CompletableFuture<Void> cf;
        try {
            cf = handleCompletably(context);
        } catch (RuntimeException ex) {
            context.fail(ex);
            return;
        }
        cf.exceptionally(throwable -> {
            context.fail(throwable);
            return null;
        });
    }

    public abstract CompletableFuture<Void> handleCompletably(RoutingContext context);
}
