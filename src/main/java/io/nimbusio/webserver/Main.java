package io.nimbusio.webserver;

import io.nimbusio.webserver.config.WebServerConfiguration;
import io.nimbusio.webserver.server.WebServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The entry point for the nimbus.io web server.
 *
 * The configuration file is named by the "webserver.config" system property, e.g.
 * "-Dwebserver.config=/etc/nimbusio/webserver.json". Without it the bundled defaults are used.
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private Main() {

    }

    public static void main(String[] args) {
        try {
            final WebServerConfiguration config = WebServerConfiguration.load();
            LOG.info("Starting the web server with {}", config);
            final WebServer webServer = new WebServer(config);
            Runtime.getRuntime().addShutdownHook(new Thread(webServer::stop, "web-server-shutdown"));
            webServer.start();
        } catch (Exception ex) {
            LOG.error("The web server encountered an exception during initialization, shutting down", ex);
            System.exit(1);
        }
    }
}
