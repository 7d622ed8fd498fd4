package io.nimbusio.webserver.api.auth;

import io.nimbusio.webserver.api.backend.DependencyCaller;
import io.nimbusio.webserver.api.common.HttpPathQueryHelpers;
import io.nimbusio.webserver.api.backend.MetadataClient;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.api.model.exceptions.NoSuchCollectionException;
import io.nimbusio.webserver.util.WebServerMetrics;
import io.vertx.core.http.HttpServerRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Authorizes requests against the access control policy of the collection they address.
 *
 * The collection is loaded (and its policy parsed) for every request. When the policy asks for it, the credentials of
 * the request are verified synchronously: a request without credentials is not authenticated, one with bad
 * credentials is forbidden.
 */
public class AuthorizationGate {

    private static final Logger LOG = LoggerFactory.getLogger(AuthorizationGate.class);

    private final MetadataClient metadataClient;
    private final DependencyCaller dependencyCaller;
    private final AccessControlParser parser;
    private final AccessControlEvaluator evaluator;
    private final PasswordAuthenticator authenticator;

    public AuthorizationGate(MetadataClient metadataClient,
                             DependencyCaller dependencyCaller,
                             AccessControlParser parser,
                             AccessControlEvaluator evaluator,
                             PasswordAuthenticator authenticator) {
        this.metadataClient = metadataClient;
        this.dependencyCaller = dependencyCaller;
        this.parser = parser;
        this.evaluator = evaluator;
        this.authenticator = authenticator;
    }

    /**
     * Authorize an HTTP request addressed to a collection route. Requests needing no access are granted without
     * looking at their headers.
     *
     * @throws io.nimbusio.webserver.api.common.HttpException if the request is malformed
     */
    public AuthorizationResult authorize(HttpServerRequest request, AccessLevel requiredLevel) {
        if (requiredLevel == AccessLevel.NO_ACCESS) {
            return AuthorizationResult.granted(null, "no access required");
        }
        return authorize(AccessRequest.fromHttpRequest(request, HttpPathQueryHelpers.getCollectionName(request),
                HttpPathQueryHelpers.getResourcePath(request), requiredLevel));
    }

    /**
     * @throws NoSuchCollectionException if the collection does not exist
     * @throws InvalidAccessControlException if the stored policy of the collection cannot be parsed
     * @throws io.nimbusio.webserver.api.model.exceptions.DependencyUnavailableException if a collaborator failed
     */
    public AuthorizationResult authorize(AccessRequest request) {
        if (request.getRequiredLevel() == AccessLevel.NO_ACCESS) {
            return AuthorizationResult.granted(null, "no access required");
        }

        final String name = request.getCollectionName();
        final Collection collection = dependencyCaller.call("get collection", () -> metadataClient.getCollection(name))
                .orElseThrow(() -> new NoSuchCollectionException("No such collection: " + name));
        final AccessControlPolicy policy = parser.parse(collection.getAccessControl().orElse(null));
        final AccessDecision decision = evaluator.evaluate(request.getRequiredLevel(), policy, request.toContext());

        final AuthorizationResult result;
        switch (decision.getOutcome()) {
            case GRANTED:
                result = AuthorizationResult.granted(collection, decision.getReason());
                break;
            case FORBIDDEN:
                result = AuthorizationResult.forbidden(collection, decision.getReason());
                break;
            case REQUIRES_SECONDARY_AUTH:
                result = authenticate(collection, request, decision);
                break;
            default:
                throw new IllegalStateException("Unknown access decision " + decision);
        }

        if (result.isGranted()) {
            WebServerMetrics.ACCESS_GRANTED.mark();
        } else {
            WebServerMetrics.ACCESS_DENIED.mark();
            LOG.info("Denied {} access to {} for {}: {}", request.getRequiredLevel().documentName(),
                    request.getPath(), request.getRequesterAddress().getHostAddress(), result.getReason());
        }
        return result;
    }

    private AuthorizationResult authenticate(Collection collection, AccessRequest request, AccessDecision decision) {
        final Optional<String> authorization = request.getAuthorization();
        if (!authorization.isPresent()) {
            return AuthorizationResult.notAuthenticated(collection, decision.getReason() + ", no credentials");
        }
        final Optional<Credentials> credentials = Credentials.parse(authorization.get());
        if (!credentials.isPresent()) {
            return AuthorizationResult.forbidden(collection, decision.getReason() + ", malformed credentials");
        }
        if (authenticator.authenticate(collection, credentials.get(), request)) {
            return AuthorizationResult.granted(collection, decision.getReason() + ", authenticated");
        }
        return AuthorizationResult.forbidden(collection, decision.getReason() + ", invalid credentials");
    }
}
