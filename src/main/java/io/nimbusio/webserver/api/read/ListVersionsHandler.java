package io.nimbusio.webserver.api.read;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nimbusio.webserver.api.auth.AccessLevel;
import io.nimbusio.webserver.api.auth.AuthorizationGate;
import io.nimbusio.webserver.api.backend.ListingBackend;
import io.nimbusio.webserver.api.common.HttpContentHelpers;
import io.nimbusio.webserver.api.common.HttpPathQueryHelpers;
import io.nimbusio.webserver.api.common.SyncHandler;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.api.model.PaginatedList;
import io.nimbusio.webserver.api.model.VersionEntry;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;

/**
 * Lists every stored version of the keys in a collection, newest version first within a key.
 */
public class ListVersionsHandler extends SyncHandler {

    static final String KEY_MARKER_PARAM = "key_marker";
    static final String VERSION_ID_MARKER_PARAM = "version_id_marker";

    private final AuthorizationGate authorizationGate;
    private final ListingBackend listingBackend;
    private final ObjectMapper mapper;

    public ListVersionsHandler(AuthorizationGate authorizationGate,
                               ListingBackend listingBackend,
                               ObjectMapper mapper) {
        this.authorizationGate = authorizationGate;
        this.listingBackend = listingBackend;
        this.mapper = mapper;
    }

    @Override
    public void handleSync(RoutingContext context) {
        final HttpServerRequest request = context.request();
        final int maxKeys = HttpPathQueryHelpers.getMaxEntries(request, ListKeysHandler.MAX_KEYS_PARAM);

        final Collection collection = authorizationGate.authorize(request, AccessLevel.LIST)
                .checkGranted(request.path());
        final PaginatedList<VersionEntry> page = listingBackend.listVersions(collection,
                HttpPathQueryHelpers.getParamOrNull(request, ListKeysHandler.PREFIX_PARAM),
                maxKeys,
                HttpPathQueryHelpers.getParamOrNull(request, KEY_MARKER_PARAM),
                HttpPathQueryHelpers.getParamOrNull(request, VERSION_ID_MARKER_PARAM));
        HttpContentHelpers.writeJsonResponse(request, context.response(), new ListResponses.VersionList(page), mapper);
    }
}
