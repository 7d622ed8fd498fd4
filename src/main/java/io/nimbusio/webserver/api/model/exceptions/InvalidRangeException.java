package io.nimbusio.webserver.api.model.exceptions;

/**
 * Thrown when a Range header does not match {@code bytes=<lower>-[<upper>]} or has a lower bound above its upper
 * bound.
 */
public class InvalidRangeException extends RuntimeException {

    public InvalidRangeException(String message) {
        super(message);
    }

    public InvalidRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
