package io.nimbusio.webserver.api.write;

import io.nimbusio.webserver.api.model.Collection;
import io.vertx.ext.web.RoutingContext;

import javax.annotation.Nullable;

/**
 * Serves one kind of authorized write request. Runs on a worker thread and may block.
 */
@FunctionalInterface
public interface WriteHandler {

    /**
     * @param collection the collection the request was authorized for, null for requests that need no access
     */
    void handle(RoutingContext context, WriteRequest request, @Nullable Collection collection);
}
