package io.nimbusio.webserver.api.auth;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.net.HostAndPort;
import com.google.common.net.HttpHeaders;
import com.google.common.net.InetAddresses;
import io.nimbusio.webserver.api.common.CommonHeaders;
import io.nimbusio.webserver.api.common.ErrorCode;
import io.nimbusio.webserver.api.common.HttpException;
import io.vertx.core.http.HttpServerRequest;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/**
 * Everything the authorization gate needs to know about a request, extracted from its HTTP form.
 */
public final class AccessRequest {

    private final AccessLevel requiredLevel;
    private final String collectionName;
    private final String resourcePath;
    private final InetAddress requesterAddress;
    @Nullable
    private final String refererHost;
    @Nullable
    private final String authorization;
    @Nullable
    private final Long timestamp;
    private final String method;
    private final String path;

    public AccessRequest(AccessLevel requiredLevel,
                         String collectionName,
                         String resourcePath,
                         InetAddress requesterAddress,
                         @Nullable String refererHost,
                         @Nullable String authorization,
                         @Nullable Long timestamp,
                         String method,
                         String path) {
        this.requiredLevel = Preconditions.checkNotNull(requiredLevel);
        this.collectionName = Preconditions.checkNotNull(collectionName);
        this.resourcePath = Preconditions.checkNotNull(resourcePath);
        this.requesterAddress = Preconditions.checkNotNull(requesterAddress);
        this.refererHost = refererHost;
        this.authorization = authorization;
        this.timestamp = timestamp;
        this.method = Preconditions.checkNotNull(method);
        this.path = Preconditions.checkNotNull(path);
    }

    /**
     * Build the access request of an HTTP request.
     *
     * @param resourcePath the path of the addressed resource relative to the collection, e.g. "/data/photos/a.jpg"
     * @throws HttpException if the X-Forwarded-For header is missing or malformed, or the Referer or timestamp headers
     *                       are malformed
     */
    public static AccessRequest fromHttpRequest(HttpServerRequest request,
                                                String collectionName,
                                                String resourcePath,
                                                AccessLevel requiredLevel) {
        final String path = request.path();
        final InetAddress requester = parseRequesterAddress(request.getHeader(CommonHeaders.X_FORWARDED_FOR), path);
        final String refererHost = parseRefererHost(request.getHeader(HttpHeaders.REFERER), path);
        return new AccessRequest(requiredLevel, collectionName, resourcePath, requester, refererHost,
                request.getHeader(HttpHeaders.AUTHORIZATION),
                parseTimestamp(request.getHeader(CommonHeaders.TIMESTAMP), path), request.rawMethod(), path);
    }

    /**
     * The original sender is the first entry of X-Forwarded-For. A request without the header is rejected.
     */
    @VisibleForTesting
    static InetAddress parseRequesterAddress(@Nullable String forwardedFor, String path) {
        if (StringUtils.isBlank(forwardedFor)) {
            throw new HttpException(ErrorCode.INVALID_REQUESTER_ADDRESS,
                    "Missing " + CommonHeaders.X_FORWARDED_FOR + " header", path);
        }
        final String first = StringUtils.substringBefore(forwardedFor, ",").trim();
        final String host;
        try {
            host = HostAndPort.fromString(first).getHost();
        } catch (IllegalArgumentException e) {
            throw new HttpException(ErrorCode.INVALID_REQUESTER_ADDRESS,
                    "Unable to parse X-Forwarded-For: " + forwardedFor, path, e);
        }
        return toAddress(host, path);
    }

    private static InetAddress toAddress(String host, String path) {
        try {
            return InetAddresses.forString(host);
        } catch (IllegalArgumentException e) {
            throw new HttpException(ErrorCode.INVALID_REQUESTER_ADDRESS,
                    "Requester address is not an IP address: " + host, path, e);
        }
    }

    /**
     * @return the lowercase host of the referer, or null when there is no referer
     */
    @VisibleForTesting
    @Nullable
    static String parseRefererHost(@Nullable String referer, String path) {
        if (StringUtils.isEmpty(referer)) {
            return null;
        }
        final URI uri;
        try {
            uri = new URI(referer.trim());
        } catch (URISyntaxException e) {
            throw new HttpException(ErrorCode.INVALID_REFERER, "Malformed Referer: " + referer, path, e);
        }
        final String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                || uri.getHost() == null) {
            throw new HttpException(ErrorCode.INVALID_REFERER,
                    "Referer must be an absolute http or https URL: " + referer, path);
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the signing time in seconds since the epoch, or null when the header is absent
     */
    @VisibleForTesting
    @Nullable
    static Long parseTimestamp(@Nullable String value, String path) {
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new HttpException(ErrorCode.INVALID_PARAMETER,
                    "Malformed " + CommonHeaders.TIMESTAMP + " header: " + value, path, e);
        }
    }

    public AccessLevel getRequiredLevel() {
        return requiredLevel;
    }

    public String getCollectionName() {
        return collectionName;
    }

    public String getResourcePath() {
        return resourcePath;
    }

    public InetAddress getRequesterAddress() {
        return requesterAddress;
    }

    public Optional<String> getRefererHost() {
        return Optional.ofNullable(refererHost);
    }

    public Optional<String> getAuthorization() {
        return Optional.ofNullable(authorization);
    }

    public Optional<Long> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    public AccessRequestContext toContext() {
        return new AccessRequestContext(requesterAddress, refererHost, resourcePath);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("requiredLevel", requiredLevel)
                .add("collectionName", collectionName)
                .add("resourcePath", resourcePath)
                .add("requesterAddress", requesterAddress.getHostAddress())
                .add("refererHost", refererHost)
                .add("method", method)
                .toString();
    }
}
