package io.nimbusio.webserver.api.model.exceptions;

/**
 * Thrown when a client supplied identifier (version or conjoined identifier) cannot be translated.
 */
public class InvalidIdentifierException extends RuntimeException {

    public InvalidIdentifierException(String message) {
        super(message);
    }

    public InvalidIdentifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
