package io.nimbusio.webserver.api;

import io.vertx.core.Vertx;
import io.vertx.ext.web.Router;

/**
 * An HTTP API served by one of the web servers.
 */
public interface Api {
    Router createRouter(Vertx vertx);
}
