package io.nimbusio.webserver.api.model.exceptions;

/**
 * Thrown when a syntactically valid range starts at or beyond the end of the object.
 */
public class RangeNotSatisfiableException extends RuntimeException {

    public RangeNotSatisfiableException(String message) {
        super(message);
    }

    public RangeNotSatisfiableException(String message, Throwable cause) {
        super(message, cause);
    }
}
