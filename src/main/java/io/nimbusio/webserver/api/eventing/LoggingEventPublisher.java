package io.nimbusio.webserver.api.eventing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * An event publisher that writes events to a dedicated log, for deployments without an event push service.
 */
public class LoggingEventPublisher implements EventPublisher {

    private static final Logger EVENT_LOG = LoggerFactory.getLogger("io.nimbusio.webserver.events");

    @Override
    public void info(String name, String message, Map<String, String> attributes) {
        EVENT_LOG.info("event={} message=\"{}\" attributes={}", name, message, attributes);
    }

    @Override
    public void exception(String name, Throwable throwable) {
        EVENT_LOG.error("event={} exctype={} message=\"{}\"",
                name, throwable.getClass().getSimpleName(), throwable.getMessage(), throwable);
    }
}
