package io.nimbusio.webserver.api.auth;

import java.util.Locale;

/**
 * What happens when an access control rule matches a request.
 */
public enum RuleEffect {
    ALLOW,
    DENY,
    /**
     * The requester must also present valid credentials.
     */
    PASSWORD;

    public static RuleEffect fromDocumentName(String name) {
        for (RuleEffect effect : values()) {
            if (effect.name().toLowerCase(Locale.ROOT).equals(name)) {
                return effect;
            }
        }
        throw new InvalidAccessControlException("Unknown rule effect: " + name);
    }
}
