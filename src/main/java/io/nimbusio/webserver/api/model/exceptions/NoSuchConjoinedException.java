package io.nimbusio.webserver.api.model.exceptions;

/**
 * Thrown when a conjoined archive does not exist or does not belong to the requested collection and key.
 */
public class NoSuchConjoinedException extends RuntimeException {

    public NoSuchConjoinedException(String message) {
        super(message);
    }

    public NoSuchConjoinedException(String message, Throwable cause) {
        super(message, cause);
    }
}
