package io.nimbusio.webserver.api.read;

import io.nimbusio.webserver.api.Api;
import io.nimbusio.webserver.api.common.CommonHandler;
import io.nimbusio.webserver.api.common.FailureHandler;
import io.nimbusio.webserver.api.common.NotFoundHandler;
import io.nimbusio.webserver.api.common.PingHandler;
import io.vertx.core.Vertx;
import io.vertx.ext.web.Router;

/**
 * The read service: object retrieval, listings and usage reports.
 */
public class ReadApi implements Api {

    private static final String PING_ROUTE = "/ping";
    private static final String OBJECT_ROUTE = "/c/([^/]+)/data/(.+)";
    private static final String KEYS_ROUTE = "/c/([^/]+)/data/?";
    private static final String VERSIONS_ROUTE = "/c/([^/]+)/versions/?";
    private static final String CONJOINED_ROUTE = "/c/([^/]+)/conjoined/?";
    private static final String CONJOINED_KEY_ROUTE = "/c/([^/]+)/conjoined/(.+)";
    private static final String USAGE_ROUTE = "/c/([^/]+)/usage/?";

    private final PingHandler pingHandler;
    private final ObjectMetaHandler objectMetaHandler;
    private final GetObjectHandler getObjectHandler;
    private final HeadObjectHandler headObjectHandler;
    private final ListKeysHandler listKeysHandler;
    private final ListVersionsHandler listVersionsHandler;
    private final ListConjoinedHandler listConjoinedHandler;
    private final ListUploadsHandler listUploadsHandler;
    private final GetUsageHandler getUsageHandler;

    private final CommonHandler commonHandler;
    private final FailureHandler failureHandler;
    private final NotFoundHandler notFoundHandler;

    public ReadApi(PingHandler pingHandler,
                   ObjectMetaHandler objectMetaHandler,
                   GetObjectHandler getObjectHandler,
                   HeadObjectHandler headObjectHandler,
                   ListKeysHandler listKeysHandler,
                   ListVersionsHandler listVersionsHandler,
                   ListConjoinedHandler listConjoinedHandler,
                   ListUploadsHandler listUploadsHandler,
                   GetUsageHandler getUsageHandler,
                   CommonHandler commonHandler,
                   FailureHandler failureHandler,
                   NotFoundHandler notFoundHandler) {
        this.pingHandler = pingHandler;
        this.objectMetaHandler = objectMetaHandler;
        this.getObjectHandler = getObjectHandler;
        this.headObjectHandler = headObjectHandler;
        this.listKeysHandler = listKeysHandler;
        this.listVersionsHandler = listVersionsHandler;
        this.listConjoinedHandler = listConjoinedHandler;
        this.listUploadsHandler = listUploadsHandler;
        this.getUsageHandler = getUsageHandler;
        this.commonHandler = commonHandler;
        this.failureHandler = failureHandler;
        this.notFoundHandler = notFoundHandler;
    }

    @Override
    public Router createRouter(Vertx vertx) {
        final Router router = Router.router(vertx);

        router.route().useNormalisedPath(false).handler(commonHandler);
        router.route().useNormalisedPath(false).failureHandler(failureHandler);

        router.get(PING_ROUTE).useNormalisedPath(false).handler(pingHandler);

        // "?action=meta" is answered by the first handler, everything else falls through to the object body
        router.getWithRegex(OBJECT_ROUTE).useNormalisedPath(false).handler(objectMetaHandler);
        router.getWithRegex(OBJECT_ROUTE).useNormalisedPath(false).handler(getObjectHandler);
        router.headWithRegex(OBJECT_ROUTE).useNormalisedPath(false).handler(headObjectHandler);

        router.getWithRegex(KEYS_ROUTE).useNormalisedPath(false).handler(listKeysHandler);
        router.getWithRegex(VERSIONS_ROUTE).useNormalisedPath(false).handler(listVersionsHandler);
        router.getWithRegex(CONJOINED_ROUTE).useNormalisedPath(false).handler(listConjoinedHandler);
        router.getWithRegex(CONJOINED_KEY_ROUTE).useNormalisedPath(false).handler(listUploadsHandler);
        router.getWithRegex(USAGE_ROUTE).useNormalisedPath(false).handler(getUsageHandler);

        // This catches requests that don't have a configured handler, so it must be the last handler in the chain.
        router.route().handler(notFoundHandler);

        return router;
    }
}
