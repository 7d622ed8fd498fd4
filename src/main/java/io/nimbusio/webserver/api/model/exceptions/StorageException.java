package io.nimbusio.webserver.api.model.exceptions;

/**
 * Thrown (or used to complete futures exceptionally) when the segment storage layer fails to read or write data.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
