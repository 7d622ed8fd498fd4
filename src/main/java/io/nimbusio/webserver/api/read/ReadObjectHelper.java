package io.nimbusio.webserver.api.read;

import com.google.common.net.HttpHeaders;
import io.nimbusio.webserver.api.auth.AccessLevel;
import io.nimbusio.webserver.api.auth.AuthorizationGate;
import io.nimbusio.webserver.api.backend.ConditionalHeaders;
import io.nimbusio.webserver.api.backend.RetrievalEngine;
import io.nimbusio.webserver.api.backend.RetrievalResult;
import io.nimbusio.webserver.api.common.HttpContentHelpers;
import io.nimbusio.webserver.api.common.HttpException;
import io.nimbusio.webserver.api.common.HttpPathQueryHelpers;
import io.nimbusio.webserver.api.common.HttpResponseStatus;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.util.VertxUtil;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The part of GET and HEAD object requests that comes before the body:
 * <ul>
 * <li>authorize the request;</li>
 * <li>resolve the object and evaluate the Range and conditional headers;</li>
 * <li>write the status and headers of the response.</li>
 * </ul>
 * Conditional short circuits (304, 412) are ended here. For content, the caller is left to send (or, for HEAD, skip)
 * the body.
 */
public class ReadObjectHelper {

    private static final Logger LOG = LoggerFactory.getLogger(ReadObjectHelper.class);

    private final AuthorizationGate authorizationGate;
    private final RetrievalEngine retrievalEngine;

    public ReadObjectHelper(AuthorizationGate authorizationGate, RetrievalEngine retrievalEngine) {
        this.authorizationGate = authorizationGate;
        this.retrievalEngine = retrievalEngine;
    }

    /**
     * @param allowRange whether the Range header is honored
     * @return the retrieval, with the response status and headers written, or empty if the response has already been
     *         ended
     */
    public CompletableFuture<Optional<AuthorizedRetrieval>> beginHandleCompletably(RoutingContext context,
                                                                                  boolean allowRange) {
        final HttpServerRequest request = context.request();
        final HttpServerResponse response = context.response();

        final String key = HttpPathQueryHelpers.getKey(request);
        final String versionIdentifier =
                HttpPathQueryHelpers.getParamOrNull(request, HttpPathQueryHelpers.VERSION_IDENTIFIER_PARAM);
        final String rangeHeader = allowRange ? request.getHeader(HttpHeaders.RANGE) : null;
        final ConditionalHeaders conditionals = new ConditionalHeaders(
                request.getHeader(HttpHeaders.IF_MODIFIED_SINCE), request.getHeader(HttpHeaders.IF_UNMODIFIED_SINCE));

        final CompletableFuture<Optional<AuthorizedRetrieval>> cf = VertxUtil.supplyAsync(context.vertx(), () -> {
            final Collection collection = authorizationGate.authorize(request, AccessLevel.READ)
                    .checkGranted(request.path());
            final RetrievalResult result =
                    retrievalEngine.retrieve(collection, key, versionIdentifier, rangeHeader, conditionals);
            return new AuthorizedRetrieval(collection, result);
        }).thenApply(retrieval -> {
            final RetrievalResult result = retrieval.getResult();
            switch (result.getKind()) {
                case NOT_MODIFIED:
                    HttpContentHelpers.writeObjectMetadataHeaders(response, result.getMetadata());
                    response.setStatusCode(HttpResponseStatus.NOT_MODIFIED).end();
                    return Optional.empty();
                case PRECONDITION_FAILED:
                    HttpContentHelpers.writeObjectMetadataHeaders(response, result.getMetadata());
                    response.setStatusCode(HttpResponseStatus.PRECONDITION_FAILED).end();
                    return Optional.empty();
                case CONTENT:
                    HttpContentHelpers.writeReadObjectResponseHeadersAndStatus(response, result.getMetadata());
                    return Optional.of(retrieval);
                default:
                    throw new IllegalStateException("Unknown retrieval result " + result.getKind());
            }
        });

        return cf.handle((val, ex) -> HttpException.handle(request, val, ex));
    }

    /**
     * Report the bytes sent to the client once the body is done. Runs off the event loop.
     */
    public void recordRetrieved(RoutingContext context, Collection collection, long bytes) {
        if (bytes <= 0) {
            return;
        }
        VertxUtil.runAsync(context.vertx(), () -> retrievalEngine.recordRetrieved(collection, bytes))
                .exceptionally(throwable -> {
                    LOG.warn("Unable to record {} bytes retrieved from {}",
                            bytes, collection.getName(), throwable);
                    return null;
                });
    }

    /**
     * A retrieval together with the collection it was authorized for.
     */
    public static final class AuthorizedRetrieval {
        private final Collection collection;
        private final RetrievalResult result;

        AuthorizedRetrieval(Collection collection, RetrievalResult result) {
            this.collection = collection;
            this.result = result;
        }

        public Collection getCollection() {
            return collection;
        }

        public RetrievalResult getResult() {
            return result;
        }
    }
}
