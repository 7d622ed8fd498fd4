package io.nimbusio.webserver.api.model.exceptions;

/**
 * Thrown when a conjoined archive operation requires an archive in a different state, for example finishing an
 * archive that was already aborted, or uploading the same part number twice.
 */
public class ConjoinedConflictException extends RuntimeException {

    public ConjoinedConflictException(String message) {
        super(message);
    }

    public ConjoinedConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
