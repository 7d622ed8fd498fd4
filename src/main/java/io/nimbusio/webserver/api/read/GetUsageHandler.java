package io.nimbusio.webserver.api.read;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nimbusio.webserver.api.auth.AccessLevel;
import io.nimbusio.webserver.api.auth.AuthorizationGate;
import io.nimbusio.webserver.api.backend.ListingBackend;
import io.nimbusio.webserver.api.common.HttpContentHelpers;
import io.nimbusio.webserver.api.common.SyncHandler;
import io.nimbusio.webserver.api.model.Collection;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;

/**
 * Reports the space accounting counters of a collection.
 */
public class GetUsageHandler extends SyncHandler {

    private final AuthorizationGate authorizationGate;
    private final ListingBackend listingBackend;
    private final ObjectMapper mapper;

    public GetUsageHandler(AuthorizationGate authorizationGate, ListingBackend listingBackend, ObjectMapper mapper) {
        this.authorizationGate = authorizationGate;
        this.listingBackend = listingBackend;
        this.mapper = mapper;
    }

    @Override
    public void handleSync(RoutingContext context) {
        final HttpServerRequest request = context.request();
        final Collection collection = authorizationGate.authorize(request, AccessLevel.READ)
                .checkGranted(request.path());
        HttpContentHelpers.writeJsonResponse(request, context.response(), listingBackend.getUsage(collection), mapper);
    }
}
