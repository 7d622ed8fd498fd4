package io.nimbusio.webserver.server;

import io.nimbusio.webserver.config.WebServerConfiguration;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.Verticle;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.spi.VerticleFactory;
import io.vertx.ext.web.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The Vert.x Verticle that manages the HTTP servers of the read and write APIs.
 */
public class WebServerVerticle extends AbstractVerticle {

    private static final Logger LOG = LoggerFactory.getLogger(WebServerVerticle.class);

    static final String VERTX_FACTORY_PREFIX = "nimbus";
    static final String VERTICLE_NAME = VERTX_FACTORY_PREFIX + ":" + WebServerVerticle.class.getName();

    // keys can make for long URIs
    private static final int MAX_HTTP_REQUEST_LINE_LENGTH = 16 * 1024;

    static final class WebServerVerticleFactory implements VerticleFactory {
        private final WebServerConfiguration wsConfig;
        private final WebServerAPIs apis;
        private final AtomicInteger readPort = new AtomicInteger();
        private final AtomicInteger writePort = new AtomicInteger();

        WebServerVerticleFactory(WebServerConfiguration wsConfig, WebServerAPIs apis) {
            this.wsConfig = wsConfig;
            this.apis = apis;
        }

        @Override
        public String prefix() {
            return VERTX_FACTORY_PREFIX;
        }

        @Override
        public Verticle createVerticle(String s, ClassLoader classLoader) {
            return new WebServerVerticle(wsConfig, apis, readPort, writePort);
        }

        int getReadPort() {
            return readPort.get();
        }

        int getWritePort() {
            return writePort.get();
        }
    }

    private final WebServerConfiguration wsConfig;
    private final WebServerAPIs apis;
    private final AtomicInteger readPort;
    private final AtomicInteger writePort;

    WebServerVerticle(WebServerConfiguration wsConfig,
                      WebServerAPIs apis,
                      AtomicInteger readPort,
                      AtomicInteger writePort) {
        this.wsConfig = wsConfig;
        this.apis = apis;
        this.readPort = readPort;
        this.writePort = writePort;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        CompletableFuture.allOf(
                startWebServer("read", wsConfig.getReadPort(), apis.getReadApi().createRouter(vertx), readPort),
                startWebServer("write", wsConfig.getWritePort(), apis.getWriteApi().createRouter(vertx), writePort))
                .whenComplete((result, throwable) -> {
                    if (throwable != null) {
                        startPromise.fail(throwable);
                    } else {
                        startPromise.complete();
                    }
                });
    }

    private CompletableFuture<Void> startWebServer(String name, int port, Router router, AtomicInteger boundPort) {
        final HttpServerOptions options = new HttpServerOptions()
                .setMaxInitialLineLength(MAX_HTTP_REQUEST_LINE_LENGTH)
                .setIdleTimeout((int) wsConfig.getHttpServerIdleTimeout().getSeconds());

        LOG.info("Creating the {} web server on {}:{}", name, wsConfig.getHost(), port);
        final CompletableFuture<Void> cf = new CompletableFuture<>();
        vertx.createHttpServer(options).requestHandler(router).listen(port, wsConfig.getHost(), result -> {
            if (result.failed()) {
                LOG.warn("Failed to start the {} web server on {}:{}", name, wsConfig.getHost(), port,
                        result.cause());
                cf.completeExceptionally(result.cause());
            } else {
                boundPort.set(result.result().actualPort());
                LOG.info("Successfully started the {} web server on {}:{}",
                        name, wsConfig.getHost(), result.result().actualPort());
                cf.complete(null);
            }
        });
        return cf;
    }
}
