package io.nimbusio.webserver.api.auth;

import com.google.common.net.InetAddresses;
import io.nimbusio.webserver.api.backend.DependencyCaller;
import io.nimbusio.webserver.api.memory.InMemoryCustomerKeyStore;
import io.nimbusio.webserver.api.model.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

class SignatureAuthenticatorTest {

    private static final Instant NOW = Instant.parse("2021-03-04T05:06:07Z");
    private static final Collection COLLECTION = new Collection(1, "photos", "alice", false, null);
    private static final String PATH = "/c/photos/data/a.jpg";

    private final DependencyCaller caller = new DependencyCaller(Duration.ofSeconds(5), 2, 4);
    private final InMemoryCustomerKeyStore keyStore = new InMemoryCustomerKeyStore();
    private final SignatureAuthenticator authenticator = new SignatureAuthenticator(keyStore, caller,
            Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMinutes(10));

    SignatureAuthenticatorTest() {
        keyStore.addKey(new CustomerKey("alice", "alice-key", "alice-secret"));
        keyStore.addKey(new CustomerKey("bob", "bob-key", "bob-secret"));
    }

    @AfterEach
    void tearDown() {
        caller.close();
    }

    private static AccessRequest request(Long timestamp) {
        return new AccessRequest(AccessLevel.READ, "photos", "/data/a.jpg", InetAddresses.forString("192.0.2.1"),
                null, null, timestamp, "GET", PATH);
    }

    private static Credentials credentials(String keyId, String secret, String owner, long timestamp) {
        return new Credentials(keyId, SignatureAuthenticator.sign(secret, owner, "GET", timestamp, PATH));
    }

    @Test
    void validSignatureIsAccepted() {
        final long ts = NOW.getEpochSecond();
        Assertions.assertTrue(authenticator.authenticate(COLLECTION,
                credentials("alice-key", "alice-secret", "alice", ts), request(ts)));
    }

    @Test
    void wrongSecretIsRejected() {
        final long ts = NOW.getEpochSecond();
        Assertions.assertFalse(authenticator.authenticate(COLLECTION,
                credentials("alice-key", "guess", "alice", ts), request(ts)));
    }

    /**
     * A valid key of another customer does not open this owner's collections.
     */
    @Test
    void keyOfAnotherOwnerIsRejected() {
        final long ts = NOW.getEpochSecond();
        Assertions.assertFalse(authenticator.authenticate(COLLECTION,
                credentials("bob-key", "bob-secret", "alice", ts), request(ts)));
    }

    @Test
    void unknownKeyIsRejected() {
        final long ts = NOW.getEpochSecond();
        Assertions.assertFalse(authenticator.authenticate(COLLECTION,
                credentials("nobody", "alice-secret", "alice", ts), request(ts)));
    }

    @Test
    void staleOrMissingTimestampIsRejected() {
        final long stale = NOW.minus(Duration.ofMinutes(11)).getEpochSecond();
        Assertions.assertFalse(authenticator.authenticate(COLLECTION,
                credentials("alice-key", "alice-secret", "alice", stale), request(stale)));
        Assertions.assertFalse(authenticator.authenticate(COLLECTION,
                credentials("alice-key", "alice-secret", "alice", NOW.getEpochSecond()), request(null)));
    }

    @Test
    void credentialsParsing() {
        final Credentials parsed = Credentials.parse("NIMBUS.IO alice-key:abcdef").get();
        Assertions.assertEquals("alice-key", parsed.getKeyId());
        Assertions.assertEquals("abcdef", parsed.getSignature());
        Assertions.assertFalse(Credentials.parse("Basic dXNlcjpwYXNz").isPresent());
        Assertions.assertFalse(Credentials.parse("NIMBUS.IO nocolon").isPresent());
        Assertions.assertFalse(Credentials.parse("NIMBUS.IO key:").isPresent());
    }
}
