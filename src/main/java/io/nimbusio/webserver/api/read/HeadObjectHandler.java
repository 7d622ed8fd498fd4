package io.nimbusio.webserver.api.read;

import io.nimbusio.webserver.api.common.CompletableHandler;
import io.nimbusio.webserver.vertx.ChunkIterator;
import io.vertx.ext.web.RoutingContext;

import java.util.concurrent.CompletableFuture;

/**
 * Returns the headers of a GET object response without the body. Range headers are ignored.
 */
public class HeadObjectHandler extends CompletableHandler {

    private final ReadObjectHelper readObjectHelper;

    public HeadObjectHandler(ReadObjectHelper readObjectHelper) {
        this.readObjectHelper = readObjectHelper;
    }

    @Override
    public CompletableFuture<Void> handleCompletably(RoutingContext context) {
        return readObjectHelper.beginHandleCompletably(context, false)
                .thenAccept(optRetrieval -> optRetrieval.ifPresent(retrieval -> {
                    retrieval.getResult().getChunks().ifPresent(ChunkIterator::close);
                    context.response().end();
                }));
    }
}
