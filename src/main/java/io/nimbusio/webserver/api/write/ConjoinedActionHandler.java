package io.nimbusio.webserver.api.write;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nimbusio.webserver.api.backend.ConjoinedArchiveManager;
import io.nimbusio.webserver.api.common.HttpContentHelpers;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.api.model.ConjoinedEntry;
import io.vertx.ext.web.RoutingContext;

import javax.annotation.Nullable;

/**
 * Starts, finishes and aborts conjoined archives. The response is the archive after the transition.
 */
public class ConjoinedActionHandler implements WriteHandler {

    private final ConjoinedArchiveManager conjoinedArchiveManager;
    private final ObjectMapper mapper;

    public ConjoinedActionHandler(ConjoinedArchiveManager conjoinedArchiveManager, ObjectMapper mapper) {
        this.conjoinedArchiveManager = conjoinedArchiveManager;
        this.mapper = mapper;
    }

    @Override
    public void handle(RoutingContext context, WriteRequest request, @Nullable Collection collection) {
        final ConjoinedEntry entry;
        switch (request.getKind()) {
            case START_CONJOINED:
                entry = conjoinedArchiveManager.start(collection, request.getKey());
                break;
            case FINISH_CONJOINED:
                entry = conjoinedArchiveManager.finish(collection, request.getKey(), request.getConjoinedIdentifier());
                break;
            case ABORT_CONJOINED:
                entry = conjoinedArchiveManager.abort(collection, request.getKey(), request.getConjoinedIdentifier());
                break;
            default:
                throw new IllegalArgumentException("Not a conjoined request: " + request.getKind());
        }
        HttpContentHelpers.writeJsonResponse(context.request(), context.response(), entry, mapper);
    }
}
