package io.nimbusio.webserver.api.auth;

/**
 * Thrown when a stored access control document cannot be parsed.
 */
public class InvalidAccessControlException extends RuntimeException {

    public InvalidAccessControlException(String message) {
        super(message);
    }

    public InvalidAccessControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
