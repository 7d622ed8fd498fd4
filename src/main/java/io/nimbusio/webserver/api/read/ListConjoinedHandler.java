package io.nimbusio.webserver.api.read;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nimbusio.webserver.api.auth.AccessLevel;
import io.nimbusio.webserver.api.auth.AuthorizationGate;
import io.nimbusio.webserver.api.backend.ConjoinedArchiveManager;
import io.nimbusio.webserver.api.common.HttpContentHelpers;
import io.nimbusio.webserver.api.common.HttpPathQueryHelpers;
import io.nimbusio.webserver.api.common.SyncHandler;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.api.model.ConjoinedEntry;
import io.nimbusio.webserver.api.model.PaginatedList;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;

/**
 * Lists the conjoined archives of a collection, including completed and aborted ones.
 */
public class ListConjoinedHandler extends SyncHandler {

    static final String MAX_CONJOINED_PARAM = "max_conjoined";
    static final String CONJOINED_IDENTIFIER_MARKER_PARAM = "conjoined_identifier_marker";

    private final AuthorizationGate authorizationGate;
    private final ConjoinedArchiveManager conjoinedArchiveManager;
    private final ObjectMapper mapper;

    public ListConjoinedHandler(AuthorizationGate authorizationGate,
                                ConjoinedArchiveManager conjoinedArchiveManager,
                                ObjectMapper mapper) {
        this.authorizationGate = authorizationGate;
        this.conjoinedArchiveManager = conjoinedArchiveManager;
        this.mapper = mapper;
    }

    @Override
    public void handleSync(RoutingContext context) {
        final HttpServerRequest request = context.request();
        final int maxConjoined = HttpPathQueryHelpers.getMaxEntries(request, MAX_CONJOINED_PARAM);

        final Collection collection = authorizationGate.authorize(request, AccessLevel.LIST)
                .checkGranted(request.path());
        final PaginatedList<ConjoinedEntry> page = conjoinedArchiveManager.listArchives(collection, maxConjoined,
                HttpPathQueryHelpers.getParamOrNull(request, ListVersionsHandler.KEY_MARKER_PARAM),
                HttpPathQueryHelpers.getParamOrNull(request, CONJOINED_IDENTIFIER_MARKER_PARAM));
        HttpContentHelpers.writeJsonResponse(request, context.response(), new ListResponses.ConjoinedList(page),
                mapper);
    }
}
