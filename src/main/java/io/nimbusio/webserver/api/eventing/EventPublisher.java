package io.nimbusio.webserver.api.eventing;

import java.util.Map;

/**
 * Pushes operational events (startup notices, unexpected failures) to the cluster's event tracking service.
 *
 * Implementations must not throw; event delivery is best effort.
 */
public interface EventPublisher {

    /**
     * Publish an informational event.
     *
     * @param name       stable event name, e.g. "web-writer-start"
     * @param message    human readable description
     * @param attributes additional key/value details
     */
    void info(String name, String message, Map<String, String> attributes);

    /**
     * Publish an unexpected failure, with its class and message.
     */
    void exception(String name, Throwable throwable);
}
