package io.nimbusio.webserver.api.write;

import io.nimbusio.webserver.api.auth.AccessLevel;
import io.nimbusio.webserver.api.auth.AuthorizationGate;
import io.nimbusio.webserver.api.auth.AuthorizationResult;
import io.nimbusio.webserver.api.common.SyncHandler;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Parses a write request, authorizes it at the level of its {@link DispatchEntry} and hands it to the entry's
 * handler.
 */
public class WriteDispatchHandler extends SyncHandler {

    private static final Logger LOG = LoggerFactory.getLogger(WriteDispatchHandler.class);

    private final WriteTarget target;
    private final WriteRequestParser parser;
    private final Map<RequestKind, DispatchEntry> dispatch;
    private final AuthorizationGate authorizationGate;

    public WriteDispatchHandler(WriteTarget target,
                                WriteRequestParser parser,
                                Map<RequestKind, DispatchEntry> dispatch,
                                AuthorizationGate authorizationGate) {
        this.target = target;
        this.parser = parser;
        this.dispatch = dispatch;
        this.authorizationGate = authorizationGate;
    }

    @Override
    public void handleSync(RoutingContext context) {
        final HttpServerRequest request = context.request();
        final WriteRequest writeRequest = parser.parse(request, target);
        final DispatchEntry entry = dispatch.get(writeRequest.getKind());
        if (entry == null) {
            throw new IllegalStateException("No handler for " + writeRequest.getKind());
        }

        LOG.debug("Dispatching {}", writeRequest);
        if (entry.getRequiredLevel() == AccessLevel.NO_ACCESS) {
            entry.getHandler().handle(context, writeRequest, null);
            return;
        }

        final AuthorizationResult result = authorizationGate.authorize(request, entry.getRequiredLevel());
        entry.getHandler().handle(context, writeRequest, result.checkGranted(request.path()));
    }
}
