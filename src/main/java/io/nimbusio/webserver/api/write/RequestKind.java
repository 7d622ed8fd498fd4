package io.nimbusio.webserver.api.write;

/**
 * The requests served by the write API.
 */
public enum RequestKind {
    RESPOND_TO_PING,
    ARCHIVE_KEY,
    DELETE_KEY,
    START_CONJOINED,
    FINISH_CONJOINED,
    ABORT_CONJOINED
}
