package io.nimbusio.webserver.api.read;

import io.nimbusio.webserver.api.common.CommonHandler;
import io.nimbusio.webserver.api.common.CompletableHandler;
import io.nimbusio.webserver.api.common.HttpContentHelpers;
import io.nimbusio.webserver.util.WebServerMetrics;
import io.nimbusio.webserver.vertx.ChunkIterator;
import io.nimbusio.webserver.vertx.ChunkReadStream;
import io.vertx.ext.web.RoutingContext;

import java.util.concurrent.CompletableFuture;

/**
 * Returns the content of an object, or the requested range of it. The body is streamed from storage as the client
 * reads it.
 */
public class GetObjectHandler extends CompletableHandler {

    private final ReadObjectHelper readObjectHelper;

    public GetObjectHandler(ReadObjectHelper readObjectHelper) {
        this.readObjectHelper = readObjectHelper;
    }

    @Override
    public CompletableFuture<Void> handleCompletably(RoutingContext context) {
        return readObjectHelper.beginHandleCompletably(context, true)
                .thenCompose(optRetrieval -> {
                    if (!optRetrieval.isPresent()) {
                        return CompletableFuture.completedFuture(null);
                    }
                    final ReadObjectHelper.AuthorizedRetrieval retrieval = optRetrieval.get();
                    final ChunkIterator chunks = retrieval.getResult().getChunks()
                            .orElseThrow(() -> new IllegalStateException("content retrieval without chunks"));
                    final ChunkReadStream stream = new ChunkReadStream(context.vertx().getOrCreateContext(), chunks);

                    CommonHandler.markStreamingResponse(context);
                    WebServerMetrics.ACTIVE_RETRIEVALS.inc();
                    return HttpContentHelpers.pumpResponseContent(context, context.response(), stream)
                            .whenComplete((v, t) -> {
                                WebServerMetrics.ACTIVE_RETRIEVALS.dec();
                                readObjectHelper.recordRetrieved(context, retrieval.getCollection(),
                                        stream.getBytesRead());
                            });
                });
    }
}
