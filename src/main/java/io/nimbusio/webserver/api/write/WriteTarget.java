package io.nimbusio.webserver.api.write;

/**
 * The kind of resource addressed by a write request path.
 */
public enum WriteTarget {
    PING,
    DATA,
    CONJOINED
}
