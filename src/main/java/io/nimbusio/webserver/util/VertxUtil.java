package io.nimbusio.webserver.util;

import io.vertx.core.Vertx;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Helpers for moving blocking work off the Vert.x event loop.
 */
public final class VertxUtil {

    private VertxUtil() {

    }

    /**
     * Run a blocking task on a Vert.x worker thread.
     *
     * The returned future completes on the context of the caller, which is the event loop when called from a
     * handler.
     */
    public static CompletableFuture<Void> runAsync(Vertx vertx, Runnable runnable) {
        return supplyAsync(vertx, () -> {
            runnable.run();
            return null;
        });
    }

    /**
     * Compute a value with blocking code on a Vert.x worker thread.
     */
    public static <T> CompletableFuture<T> supplyAsync(Vertx vertx, Supplier<T> supplier) {
        final CompletableFuture<T> cf = new CompletableFuture<>();
        vertx.<T>executeBlocking(promise -> promise.complete(supplier.get()), false, ar -> {
            if (ar.succeeded()) {
                cf.complete(ar.result());
            } else {
                cf.completeExceptionally(ar.cause());
            }
        });
        return cf;
    }
}
