package io.nimbusio.webserver.api.auth;

import com.google.common.net.InetAddresses;
import io.nimbusio.webserver.api.backend.DependencyCaller;
import io.nimbusio.webserver.api.common.ErrorCode;
import io.nimbusio.webserver.api.common.HttpException;
import io.nimbusio.webserver.api.memory.InMemoryMetadataClient;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.api.model.exceptions.NoSuchCollectionException;
import io.nimbusio.webserver.util.ObjectMappers;
import io.vertx.core.http.HttpServerRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.net.InetAddress;
import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;

class AuthorizationGateTest {

    private static final InetAddress LOCAL = InetAddresses.forString("10.0.0.5");
    private static final InetAddress REMOTE = InetAddresses.forString("192.0.2.1");

    private final InMemoryMetadataClient metadata = new InMemoryMetadataClient();
    private final DependencyCaller caller = new DependencyCaller(Duration.ofSeconds(5), 2, 4);
    private final PasswordAuthenticator authenticator = Mockito.mock(PasswordAuthenticator.class);
    private final AuthorizationGate gate = new AuthorizationGate(metadata, caller,
            new AccessControlParser(ObjectMappers.createApiObjectMapper()), new AccessControlEvaluator(), authenticator);

    private final Collection collection;

    AuthorizationGateTest() {
        collection = metadata.createCollection("photos", "alice", false,
                "{\"ip_rules\": [{\"cidr\": \"10.0.0.0/8\", \"effect\": \"allow\", \"levels\": [\"read\"]}]}");
    }

    @AfterEach
    void tearDown() {
        caller.close();
    }

    private static AccessRequest request(AccessLevel level, String collectionName, InetAddress from,
                                         String authorization) {
        return new AccessRequest(level, collectionName, "/data/a", from, null, authorization, null, "GET",
                "/c/" + collectionName + "/data/a");
    }

    @Test
    void noAccessSkipsTheCollectionLookup() {
        final AuthorizationResult result = gate.authorize(request(AccessLevel.NO_ACCESS, "", REMOTE, null));
        Assertions.assertTrue(result.isGranted());
        Assertions.assertFalse(result.getCollection().isPresent());
        Mockito.verifyNoInteractions(authenticator);
    }

    /**
     * Health checks are granted whatever the headers of the request say.
     */
    @Test
    void noAccessIgnoresTheHttpRequest() {
        final HttpServerRequest httpRequest = Mockito.mock(HttpServerRequest.class);
        Mockito.when(httpRequest.getHeader(Mockito.anyString())).thenReturn("not-an-ip");

        final AuthorizationResult result = gate.authorize(httpRequest, AccessLevel.NO_ACCESS);

        Assertions.assertTrue(result.isGranted());
        Mockito.verify(httpRequest, Mockito.never()).getHeader(Mockito.anyString());
    }

    @Test
    void unknownCollectionIsNotFound() {
        Assertions.assertThrows(NoSuchCollectionException.class,
                () -> gate.authorize(request(AccessLevel.READ, "missing", LOCAL, null)));
    }

    @Test
    void matchingIpRuleGrantsAccess() {
        final AuthorizationResult result = gate.authorize(request(AccessLevel.READ, "photos", LOCAL, null));
        Assertions.assertEquals(collection, result.checkGranted("/c/photos/data/a"));
    }

    /**
     * Without a matching rule the default is to require credentials; asking without any is a 401.
     */
    @Test
    void missingCredentialsAreNotAuthenticated() {
        final AuthorizationResult result = gate.authorize(request(AccessLevel.READ, "photos", REMOTE, null));
        Assertions.assertEquals(AuthorizationResult.Status.NOT_AUTHENTICATED, result.getStatus());
        final HttpException ex = Assertions.assertThrows(HttpException.class, () -> result.checkGranted("/"));
        Assertions.assertEquals(ErrorCode.NOT_AUTHENTICATED, ex.getErrorCode());
    }

    @Test
    void malformedCredentialsAreForbidden() {
        final AuthorizationResult result = gate.authorize(request(AccessLevel.READ, "photos", REMOTE, "Basic xyz"));
        Assertions.assertEquals(AuthorizationResult.Status.FORBIDDEN, result.getStatus());
        Mockito.verifyNoInteractions(authenticator);
    }

    @Test
    void credentialsAreCheckedByTheAuthenticator() {
        Mockito.when(authenticator.authenticate(any(), any(), any())).thenReturn(true, false);

        Assertions.assertTrue(gate.authorize(request(AccessLevel.WRITE, "photos", LOCAL, "NIMBUS.IO k:sig")).isGranted());
        Assertions.assertEquals(AuthorizationResult.Status.FORBIDDEN,
                gate.authorize(request(AccessLevel.WRITE, "photos", LOCAL, "NIMBUS.IO k:sig")).getStatus());
    }

    @Test
    void invalidStoredPolicyFails() {
        metadata.createCollection("broken", "alice", false, "{\"ip_rules\": 3}");
        Assertions.assertThrows(InvalidAccessControlException.class,
                () -> gate.authorize(request(AccessLevel.READ, "broken", LOCAL, null)));
    }
}
