package io.nimbusio.webserver.api.read;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nimbusio.webserver.api.auth.AccessLevel;
import io.nimbusio.webserver.api.auth.AuthorizationGate;
import io.nimbusio.webserver.api.backend.ConjoinedArchiveManager;
import io.nimbusio.webserver.api.common.ErrorCode;
import io.nimbusio.webserver.api.common.HttpContentHelpers;
import io.nimbusio.webserver.api.common.HttpException;
import io.nimbusio.webserver.api.common.HttpPathQueryHelpers;
import io.nimbusio.webserver.api.common.SyncHandler;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.api.model.ConjoinedPart;
import io.nimbusio.webserver.api.model.PaginatedList;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;

/**
 * Lists the parts uploaded so far to an active conjoined archive.
 */
public class ListUploadsHandler extends SyncHandler {

    static final String MAX_PARTS_PARAM = "max_parts";

    private final AuthorizationGate authorizationGate;
    private final ConjoinedArchiveManager conjoinedArchiveManager;
    private final ObjectMapper mapper;

    public ListUploadsHandler(AuthorizationGate authorizationGate,
                              ConjoinedArchiveManager conjoinedArchiveManager,
                              ObjectMapper mapper) {
        this.authorizationGate = authorizationGate;
        this.conjoinedArchiveManager = conjoinedArchiveManager;
        this.mapper = mapper;
    }

    @Override
    public void handleSync(RoutingContext context) {
        final HttpServerRequest request = context.request();
        final String key = HttpPathQueryHelpers.getKey(request);
        final String conjoinedIdentifier = HttpPathQueryHelpers
                .getOptionalParam(request, HttpPathQueryHelpers.CONJOINED_IDENTIFIER_PARAM)
                .orElseThrow(() -> new HttpException(ErrorCode.INVALID_PARAMETER,
                        "The '" + HttpPathQueryHelpers.CONJOINED_IDENTIFIER_PARAM + "' query parameter is required",
                        request.path()));
        final int maxParts = HttpPathQueryHelpers.getMaxEntries(request, MAX_PARTS_PARAM);

        final Collection collection = authorizationGate.authorize(request, AccessLevel.LIST)
                .checkGranted(request.path());
        final PaginatedList<ConjoinedPart> parts =
                conjoinedArchiveManager.listUploadsInArchive(collection, key, conjoinedIdentifier, maxParts);
        HttpContentHelpers.writeJsonResponse(request, context.response(), new ListResponses.UploadList(parts),
                mapper);
    }
}
