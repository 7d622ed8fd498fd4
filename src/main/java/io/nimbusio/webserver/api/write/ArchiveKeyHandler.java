package io.nimbusio.webserver.api.write;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nimbusio.webserver.api.backend.ArchiveWriter;
import io.nimbusio.webserver.api.common.HttpContentHelpers;
import io.nimbusio.webserver.api.model.Collection;
import io.vertx.core.buffer.Buffer;
import io.vertx.ext.web.RoutingContext;

import javax.annotation.Nullable;

/**
 * Stores the request body as a new version of a key, or as a part of a conjoined archive.
 */
public class ArchiveKeyHandler implements WriteHandler {

    private final ArchiveWriter archiveWriter;
    private final ObjectMapper mapper;

    public ArchiveKeyHandler(ArchiveWriter archiveWriter, ObjectMapper mapper) {
        this.archiveWriter = archiveWriter;
        this.mapper = mapper;
    }

    @Override
    public void handle(RoutingContext context, WriteRequest request, @Nullable Collection collection) {
        final Buffer body = context.getBody() == null ? Buffer.buffer() : context.getBody();
        final String identifier = archiveWriter.archive(collection, request.getKey(), body,
                request.getConjoinedIdentifier(), request.getConjoinedPart());
        final WriteResponse response = request.getConjoinedIdentifier() == null
                ? WriteResponse.archived(identifier)
                : WriteResponse.partArchived(identifier, request.getConjoinedPart());
        HttpContentHelpers.writeJsonResponse(context.request(), context.response(), response, mapper);
    }
}
