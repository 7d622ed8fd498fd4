package io.nimbusio.webserver.api.auth;

import com.google.common.base.MoreObjects;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * The credentials presented in an Authorization header of the form {@code NIMBUS.IO <key id>:<signature>}.
 */
public final class Credentials {

    public static final String SCHEME = "NIMBUS.IO";

    private final String keyId;
    private final String signature;

    public Credentials(String keyId, String signature) {
        this.keyId = keyId;
        this.signature = signature;
    }

    /**
     * @return empty if the header does not use the NIMBUS.IO scheme or is malformed
     */
    public static Optional<Credentials> parse(@Nullable String authorization) {
        if (authorization == null) {
            return Optional.empty();
        }
        final String value = authorization.trim();
        if (!StringUtils.startsWithIgnoreCase(value, SCHEME + " ")) {
            return Optional.empty();
        }
        final String token = value.substring(SCHEME.length() + 1).trim();
        final int colon = token.indexOf(':');
        if (colon <= 0 || colon == token.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new Credentials(token.substring(0, colon), token.substring(colon + 1)));
    }

    public String getKeyId() {
        return keyId;
    }

    public String getSignature() {
        return signature;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("keyId", keyId)
                .toString();
    }
}
