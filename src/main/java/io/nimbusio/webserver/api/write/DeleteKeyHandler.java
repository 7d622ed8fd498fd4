package io.nimbusio.webserver.api.write;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nimbusio.webserver.api.backend.ArchiveWriter;
import io.nimbusio.webserver.api.common.HttpContentHelpers;
import io.nimbusio.webserver.api.model.Collection;
import io.vertx.ext.web.RoutingContext;

import javax.annotation.Nullable;

/**
 * Deletes a key, or a single version of it.
 */
public class DeleteKeyHandler implements WriteHandler {

    private final ArchiveWriter archiveWriter;
    private final ObjectMapper mapper;

    public DeleteKeyHandler(ArchiveWriter archiveWriter, ObjectMapper mapper) {
        this.archiveWriter = archiveWriter;
        this.mapper = mapper;
    }

    @Override
    public void handle(RoutingContext context, WriteRequest request, @Nullable Collection collection) {
        archiveWriter.delete(collection, request.getKey(), request.getVersionIdentifier());
        HttpContentHelpers.writeJsonResponse(context.request(), context.response(), WriteResponse.deleted(), mapper);
    }
}
