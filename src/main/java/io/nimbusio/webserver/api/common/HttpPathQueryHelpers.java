package io.nimbusio.webserver.api.common;

import com.google.common.base.Strings;
import io.vertx.core.http.HttpServerRequest;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * Helper methods for dealing with HTTP path and query parameters.
 *
 * Collection routes have the form {@code /c/<collection>/<resource>}; the collection is the first regex group of
 * the route ("param0") and the key, where there is one, is the second ("param1").
 */
public final class HttpPathQueryHelpers {

    private HttpPathQueryHelpers() {

    }

    public static final String COLLECTION_PARAM = "param0";
    public static final String KEY_PARAM = "param1";

    public static final String ACTION_PARAM = "action";
    public static final String VERSION_IDENTIFIER_PARAM = "version_identifier";
    public static final String CONJOINED_IDENTIFIER_PARAM = "conjoined_identifier";
    public static final String CONJOINED_PART_PARAM = "conjoined_part";

    public static final int DEFAULT_MAX_ENTRIES = 1000;
    static final int MAX_ENTRIES = 1000;

    private static final String COLLECTION_PATH_PREFIX = "/c/";

    public static String getCollectionName(HttpServerRequest request) {
        final String name = request.getParam(COLLECTION_PARAM);
        if (Strings.isNullOrEmpty(name)) {
            throw new HttpException(ErrorCode.UNPARSABLE_REQUEST, "Missing collection name", request.path());
        }
        return name;
    }

    public static String getKey(HttpServerRequest request) {
        final String key = request.getParam(KEY_PARAM);
        if (Strings.isNullOrEmpty(key)) {
            throw new HttpException(ErrorCode.UNPARSABLE_REQUEST, "Missing key", request.path());
        }
        return key;
    }

    /**
     * The path of the request relative to its collection, e.g. "/data/photos/a.jpg" for
     * "/c/family/data/photos/a.jpg". Requests outside a collection map to their whole path.
     */
    public static String getResourcePath(HttpServerRequest request) {
        final String path = request.path();
        if (!path.startsWith(COLLECTION_PATH_PREFIX)) {
            return path;
        }
        final int slash = path.indexOf('/', COLLECTION_PATH_PREFIX.length());
        return slash < 0 ? "/" : path.substring(slash);
    }

    public static Optional<String> getOptionalParam(HttpServerRequest request, String name) {
        return Optional.ofNullable(Strings.emptyToNull(request.getParam(name)));
    }

    @Nullable
    public static String getParamOrNull(HttpServerRequest request, String name) {
        return Strings.emptyToNull(request.getParam(name));
    }

    /**
     * Parse a "max_*" page size parameter. Values above the maximum page size are lowered to it.
     */
    public static int getMaxEntries(HttpServerRequest request, String name) {
        final String value = request.getParam(name);
        if (Strings.isNullOrEmpty(value)) {
            return DEFAULT_MAX_ENTRIES;
        }
        final int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException nfex) {
            throw new HttpException(ErrorCode.INVALID_PARAMETER,
                    "The '" + name + "' query parameter must be a valid integer (it was '" + value + "')",
                    request.path(), nfex);
        }
        if (parsed < 1) {
            throw new HttpException(ErrorCode.INVALID_PARAMETER,
                    "The '" + name + "' query parameter must be positive (it was " + parsed + ")", request.path());
        }
        return Math.min(parsed, MAX_ENTRIES);
    }
}
