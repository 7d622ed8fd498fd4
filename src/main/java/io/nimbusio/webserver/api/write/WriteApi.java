package io.nimbusio.webserver.api.write;

import com.google.common.collect.Maps;
import io.nimbusio.webserver.api.Api;
import io.nimbusio.webserver.api.auth.AccessLevel;
import io.nimbusio.webserver.api.auth.AuthorizationGate;
import io.nimbusio.webserver.api.common.CommonHandler;
import io.nimbusio.webserver.api.common.FailureHandler;
import io.nimbusio.webserver.api.common.NotFoundHandler;
import io.nimbusio.webserver.api.common.PingHandler;
import io.vertx.core.Vertx;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The write service: archiving and deleting keys, and the lifecycle of conjoined archives.
 *
 * Every request is parsed into a {@link RequestKind} and dispatched through a fixed table that names its handler and
 * the access level it needs.
 */
public class WriteApi implements Api {

    private static final String PING_ROUTE = "/ping";
    private static final String DATA_ROUTE = "/c/([^/]+)/data/(.+)";
    private static final String CONJOINED_ROUTE = "/c/([^/]+)/conjoined/(.+)";

    private final Map<RequestKind, DispatchEntry> dispatch;
    private final WriteRequestParser parser;
    private final AuthorizationGate authorizationGate;
    private final CommonHandler commonHandler;
    private final FailureHandler failureHandler;
    private final NotFoundHandler notFoundHandler;
    private final long maxArchiveSize;

    public WriteApi(PingHandler pingHandler,
                    ArchiveKeyHandler archiveKeyHandler,
                    DeleteKeyHandler deleteKeyHandler,
                    ConjoinedActionHandler conjoinedActionHandler,
                    WriteRequestParser parser,
                    AuthorizationGate authorizationGate,
                    CommonHandler commonHandler,
                    FailureHandler failureHandler,
                    NotFoundHandler notFoundHandler,
                    long maxArchiveSize) {
        final EnumMap<RequestKind, DispatchEntry> entries = Maps.newEnumMap(RequestKind.class);
        entries.put(RequestKind.RESPOND_TO_PING,
                new DispatchEntry((context, request, collection) -> pingHandler.handle(context), AccessLevel.NO_ACCESS));
        entries.put(RequestKind.ARCHIVE_KEY, new DispatchEntry(archiveKeyHandler, AccessLevel.WRITE));
        entries.put(RequestKind.DELETE_KEY, new DispatchEntry(deleteKeyHandler, AccessLevel.DELETE));
        entries.put(RequestKind.START_CONJOINED, new DispatchEntry(conjoinedActionHandler, AccessLevel.WRITE));
        entries.put(RequestKind.FINISH_CONJOINED, new DispatchEntry(conjoinedActionHandler, AccessLevel.WRITE));
        entries.put(RequestKind.ABORT_CONJOINED, new DispatchEntry(conjoinedActionHandler, AccessLevel.WRITE));
        this.dispatch = Collections.unmodifiableMap(entries);

        this.parser = parser;
        this.authorizationGate = authorizationGate;
        this.commonHandler = commonHandler;
        this.failureHandler = failureHandler;
        this.notFoundHandler = notFoundHandler;
        this.maxArchiveSize = maxArchiveSize;
    }

    public Map<RequestKind, DispatchEntry> getDispatch() {
        return dispatch;
    }

    @Override
    public Router createRouter(Vertx vertx) {
        final Router router = Router.router(vertx);

        router.route().useNormalisedPath(false).handler(commonHandler);
        router.route().useNormalisedPath(false).failureHandler(failureHandler);
        router.route().useNormalisedPath(false)
                .handler(BodyHandler.create().setHandleFileUploads(false).setBodyLimit(maxArchiveSize));

        router.route(PING_ROUTE).useNormalisedPath(false).handler(dispatchHandler(WriteTarget.PING));
        router.routeWithRegex(DATA_ROUTE).useNormalisedPath(false).handler(dispatchHandler(WriteTarget.DATA));
        router.routeWithRegex(CONJOINED_ROUTE).useNormalisedPath(false)
                .handler(dispatchHandler(WriteTarget.CONJOINED));

        // This catches requests that don't have a configured handler, so it must be the last handler in the chain.
        router.route().handler(notFoundHandler);

        return router;
    }

    private WriteDispatchHandler dispatchHandler(WriteTarget target) {
        return new WriteDispatchHandler(target, parser, dispatch, authorizationGate);
    }
}
