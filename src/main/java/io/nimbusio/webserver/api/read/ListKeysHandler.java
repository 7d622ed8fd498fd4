package io.nimbusio.webserver.api.read;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nimbusio.webserver.api.auth.AccessLevel;
import io.nimbusio.webserver.api.auth.AuthorizationGate;
import io.nimbusio.webserver.api.backend.ListingBackend;
import io.nimbusio.webserver.api.common.HttpContentHelpers;
import io.nimbusio.webserver.api.common.HttpPathQueryHelpers;
import io.nimbusio.webserver.api.common.SyncHandler;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.api.model.KeyPage;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;

/**
 * Lists the live keys of a collection, optionally rolled up into common prefixes by a delimiter.
 */
public class ListKeysHandler extends SyncHandler {

    static final String PREFIX_PARAM = "prefix";
    static final String MAX_KEYS_PARAM = "max_keys";
    static final String MARKER_PARAM = "marker";
    static final String DELIMITER_PARAM = "delimiter";

    private final AuthorizationGate authorizationGate;
    private final ListingBackend listingBackend;
    private final ObjectMapper mapper;

    public ListKeysHandler(AuthorizationGate authorizationGate, ListingBackend listingBackend, ObjectMapper mapper) {
        this.authorizationGate = authorizationGate;
        this.listingBackend = listingBackend;
        this.mapper = mapper;
    }

    @Override
    public void handleSync(RoutingContext context) {
        final HttpServerRequest request = context.request();
        final int maxKeys = HttpPathQueryHelpers.getMaxEntries(request, MAX_KEYS_PARAM);

        final Collection collection = authorizationGate.authorize(request, AccessLevel.LIST)
                .checkGranted(request.path());
        final KeyPage page = listingBackend.listKeys(collection,
                HttpPathQueryHelpers.getParamOrNull(request, PREFIX_PARAM),
                maxKeys,
                HttpPathQueryHelpers.getParamOrNull(request, MARKER_PARAM),
                HttpPathQueryHelpers.getParamOrNull(request, DELIMITER_PARAM));
        HttpContentHelpers.writeJsonResponse(request, context.response(), page, mapper);
    }
}
