package io.nimbusio.webserver.api.model.exceptions;

/**
 * Thrown when an If-Modified-Since or If-Unmodified-Since header is not a valid HTTP date.
 */
public class InvalidTimestampException extends RuntimeException {

    public InvalidTimestampException(String message) {
        super(message);
    }

    public InvalidTimestampException(String message, Throwable cause) {
        super(message, cause);
    }
}
