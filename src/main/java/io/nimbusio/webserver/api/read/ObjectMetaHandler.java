package io.nimbusio.webserver.api.read;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nimbusio.webserver.api.auth.AccessLevel;
import io.nimbusio.webserver.api.auth.AuthorizationGate;
import io.nimbusio.webserver.api.backend.RetrievalEngine;
import io.nimbusio.webserver.api.common.HttpContentHelpers;
import io.nimbusio.webserver.api.common.HttpPathQueryHelpers;
import io.nimbusio.webserver.api.common.SyncHandler;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.api.model.ObjectMetadata;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;

/**
 * Handles {@code GET /c/<collection>/data/<key>?action=meta}: the metadata of an object as JSON. Other GET requests
 * on the route are passed on to the next handler.
 */
public class ObjectMetaHandler extends SyncHandler {

    static final String META_ACTION = "meta";

    private final AuthorizationGate authorizationGate;
    private final RetrievalEngine retrievalEngine;
    private final ObjectMapper mapper;

    public ObjectMetaHandler(AuthorizationGate authorizationGate, RetrievalEngine retrievalEngine, ObjectMapper mapper) {
        this.authorizationGate = authorizationGate;
        this.retrievalEngine = retrievalEngine;
        this.mapper = mapper;
    }

    @Override
    public void handle(RoutingContext context) {
        if (!META_ACTION.equals(context.request().getParam(HttpPathQueryHelpers.ACTION_PARAM))) {
            context.next();
            return;
        }
        super.handle(context);
    }

    @Override
    public void handleSync(RoutingContext context) {
        final HttpServerRequest request = context.request();
        final String key = HttpPathQueryHelpers.getKey(request);
        final String versionIdentifier =
                HttpPathQueryHelpers.getParamOrNull(request, HttpPathQueryHelpers.VERSION_IDENTIFIER_PARAM);

        final Collection collection = authorizationGate.authorize(request, AccessLevel.READ)
                .checkGranted(request.path());
        final ObjectMetadata metadata = retrievalEngine.getMetadata(collection, key, versionIdentifier);
        HttpContentHelpers.writeJsonResponse(request, context.response(), new MetadataResponse(metadata), mapper);
    }
}
