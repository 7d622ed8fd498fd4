package io.nimbusio.webserver.api.model.exceptions;

/**
 * Thrown when an external dependency (metadata, accounting or authentication) fails or does not answer within
 * the configured timeout. Callers must not retry in-process.
 */
public class DependencyUnavailableException extends RuntimeException {

    public DependencyUnavailableException(String message) {
        super(message);
    }

    public DependencyUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
