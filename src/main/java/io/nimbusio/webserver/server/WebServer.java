package io.nimbusio.webserver.server;

import com.codahale.metrics.Slf4jReporter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import io.nimbusio.webserver.api.eventing.EventPublisher;
import io.nimbusio.webserver.api.eventing.LoggingEventPublisher;
import io.nimbusio.webserver.config.WebServerConfiguration;
import io.nimbusio.webserver.util.ObjectMappers;
import io.nimbusio.webserver.util.WebServerMetrics;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * The nimbus.io web server: the read and write APIs and everything they run on.
 */
public final class WebServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebServer.class);

    private static final long METRICS_REPORT_MINUTES = 1;

    private final WebServerConfiguration config;
    private final EventPublisher eventPublisher;
    private final WebServerBackends backends;
    private final WebServerVerticle.WebServerVerticleFactory verticleFactory;
    private final Slf4jReporter metricsReporter;
    private final Vertx vertx;

    private String deploymentId;

    public WebServer(WebServerConfiguration config) {
        this(config, new LoggingEventPublisher(), Clock.systemUTC());
    }

    public WebServer(WebServerConfiguration config, EventPublisher eventPublisher, Clock clock) {
        this.config = config;
        this.eventPublisher = eventPublisher;

        final ObjectMapper mapper = ObjectMappers.createApiObjectMapper();
        final WebServerClients clients = new WebServerClients(config);
        backends = new WebServerBackends(config, clients, eventPublisher, mapper, clock);
        final WebServerAPIs apis = new WebServerAPIs(config, backends, eventPublisher, mapper);

        metricsReporter = Slf4jReporter.forRegistry(WebServerMetrics.REGISTRY)
                .outputTo(LoggerFactory.getLogger("io.nimbusio.webserver.metrics"))
                .convertRatesTo(TimeUnit.SECONDS)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build();

        vertx = Vertx.vertx();
        verticleFactory = new WebServerVerticle.WebServerVerticleFactory(config, apis);
        vertx.registerVerticleFactory(verticleFactory);
        deploymentId = null;
    }

    /**
     * Starts metrics reporting and the read and write servers. Returns once both servers are listening.
     */
    public void start() {
        metricsReporter.start(METRICS_REPORT_MINUTES, TimeUnit.MINUTES);

        final DeploymentOptions options = new DeploymentOptions().setInstances(config.getVerticleInstances());
        final CompletableFuture<String> cf = new CompletableFuture<>();
        vertx.deployVerticle(WebServerVerticle.VERTICLE_NAME, options, result -> {
            if (result.failed()) {
                cf.completeExceptionally(result.cause());
            } else {
                cf.complete(result.result());
            }
        });
        deploymentId = cf.join();

        eventPublisher.info("web-writer-start", "web server started", ImmutableMap.of(
                "node", config.getNodeName(),
                "unified_id", Long.toString(backends.getIdFactory().next().longValue()),
                "read_port", Integer.toString(getReadPort()),
                "write_port", Integer.toString(getWritePort())));
    }

    /**
     * Stop the web server, close all client connections and un-deploy all verticles. It is safe to call this method
     * multiple times, and to call it without having first called start.
     * <p>
     * This method will not throw any exceptions, all internal exceptions are logged and ignored.
     */
    public void stop() {
        try {
            metricsReporter.stop();
        } catch (Exception ex) {
            LOGGER.warn("Failed to stop the metrics reporter", ex);
        }

        try {
            if (deploymentId != null) {
                final CompletableFuture<Void> cf = new CompletableFuture<>();
                vertx.undeploy(deploymentId, result -> {
                    if (result.failed()) {
                        cf.completeExceptionally(result.cause());
                    } else {
                        cf.complete(null);
                    }
                });
                cf.join();
                deploymentId = null;
            }
        } catch (Exception ex) {
            LOGGER.warn("Failed to un-deploy the web server verticles", ex);
        }

        try {
            final CompletableFuture<Void> cf = new CompletableFuture<>();
            vertx.close(result -> {
                if (result.failed()) {
                    cf.completeExceptionally(result.cause());
                } else {
                    cf.complete(null);
                }
            });
            cf.join();
        } catch (Exception ex) {
            LOGGER.warn("Failed to close the web server Vertx instance", ex);
        }

        backends.close();
    }

    /**
     * The port the read server listens on, which differs from the configured one when that was 0.
     */
    public int getReadPort() {
        return verticleFactory.getReadPort();
    }

    public int getWritePort() {
        return verticleFactory.getWritePort();
    }
}
