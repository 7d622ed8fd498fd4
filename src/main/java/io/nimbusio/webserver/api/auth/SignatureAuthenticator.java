package io.nimbusio.webserver.api.auth;

import com.google.common.io.BaseEncoding;
import io.nimbusio.webserver.api.backend.DependencyCaller;
import io.nimbusio.webserver.api.model.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Checks request signatures made with a customer key.
 *
 * The signature is the lowercase hex HMAC-SHA256, keyed with the secret, of the string
 * {@code owner + "\n" + method + "\n" + timestamp + "\n" + path}, where the timestamp is the value of the
 * x-nimbus-io-timestamp header in seconds since the epoch. Requests whose timestamp is further than the allowed clock
 * skew from now are rejected.
 */
public class SignatureAuthenticator implements PasswordAuthenticator {

    private static final Logger LOG = LoggerFactory.getLogger(SignatureAuthenticator.class);

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    private final CustomerKeyStore keyStore;
    private final DependencyCaller dependencyCaller;
    private final Clock clock;
    private final Duration maxClockSkew;

    public SignatureAuthenticator(CustomerKeyStore keyStore,
                                  DependencyCaller dependencyCaller,
                                  Clock clock,
                                  Duration maxClockSkew) {
        this.keyStore = keyStore;
        this.dependencyCaller = dependencyCaller;
        this.clock = clock;
        this.maxClockSkew = maxClockSkew;
    }

    @Override
    public boolean authenticate(Collection collection, Credentials credentials, AccessRequest request) {
        final Optional<Long> timestamp = request.getTimestamp();
        if (!timestamp.isPresent()) {
            LOG.debug("Signed request without a timestamp");
            return false;
        }
        final Duration skew = Duration.between(Instant.ofEpochSecond(timestamp.get()), clock.instant()).abs();
        if (skew.compareTo(maxClockSkew) > 0) {
            LOG.debug("Signed request timestamp is {} away from now", skew);
            return false;
        }

        final Optional<CustomerKey> key = dependencyCaller.call("get customer key",
                () -> keyStore.getKey(credentials.getKeyId()));
        if (!key.isPresent()) {
            LOG.debug("Unknown key id {}", credentials.getKeyId());
            return false;
        }
        if (!key.get().getOwner().equals(collection.getOwner())) {
            LOG.debug("Key {} does not belong to the owner of {}", credentials.getKeyId(), collection.getName());
            return false;
        }

        final String expected = sign(key.get().getSecret(), collection.getOwner(), request.getMethod(),
                timestamp.get(), request.getPath());
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.US_ASCII),
                credentials.getSignature().getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * Compute the signature of a request.
     */
    public static String sign(String secret, String owner, String method, long timestamp, String path) {
        final String stringToSign = owner + "\n" + method + "\n" + timestamp + "\n" + path;
        try {
            final Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HEX.encode(mac.doFinal(stringToSign.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }
}
