package io.nimbusio.webserver.api.auth;

import java.util.Locale;

/**
 * The access a request needs to a collection. {@link #NO_ACCESS} requests (health checks) skip authorization.
 */
public enum AccessLevel {
    NO_ACCESS,
    READ,
    LIST,
    WRITE,
    DELETE;

    /**
     * The name used for this level in access control documents.
     */
    public String documentName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AccessLevel fromDocumentName(String name) {
        for (AccessLevel level : values()) {
            if (level.documentName().equals(name)) {
                return level;
            }
        }
        throw new InvalidAccessControlException("Unknown access level: " + name);
    }
}
