package io.nimbusio.webserver.api.model.exceptions;

/**
 * Wraps an unexpected failure that has already been reported to the event publisher, so that it is not reported a
 * second time on its way out of the request.
 */
public class RecordedFaultException extends RuntimeException {

    public RecordedFaultException(Throwable cause) {
        super(cause.getMessage(), cause);
    }
}
