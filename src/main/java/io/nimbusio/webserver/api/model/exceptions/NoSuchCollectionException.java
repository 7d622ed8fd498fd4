package io.nimbusio.webserver.api.model.exceptions;

/**
 * Thrown when a request names a collection that does not exist.
 */
public class NoSuchCollectionException extends RuntimeException {

    public NoSuchCollectionException(String message) {
        super(message);
    }

    public NoSuchCollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
