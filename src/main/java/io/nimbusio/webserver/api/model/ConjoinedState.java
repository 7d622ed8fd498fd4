package io.nimbusio.webserver.api.model;

/**
 * States of a conjoined (multi-part) archive. The only transitions are ACTIVE to COMPLETED and ACTIVE to ABORTED.
 */
public enum ConjoinedState {
    ACTIVE,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
