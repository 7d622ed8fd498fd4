package io.nimbusio.webserver.api.model.exceptions;

/**
 * Thrown when a key, or the requested version of a key, does not exist or is not readable.
 */
public class NoSuchKeyException extends RuntimeException {

    public NoSuchKeyException(String message) {
        super(message);
    }

    public NoSuchKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
