package io.nimbusio.webserver.api.write;

import com.google.common.base.Strings;
import io.nimbusio.webserver.api.common.ErrorCode;
import io.nimbusio.webserver.api.common.HttpException;
import io.nimbusio.webserver.api.common.HttpPathQueryHelpers;
import io.vertx.core.MultiMap;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServerRequest;

import javax.annotation.Nullable;

/**
 * Turns an HTTP request on the write service into a {@link WriteRequest}.
 *
 * Any combination of method, target and action that is not a known request is unparsable (400).
 */
public final class WriteRequestParser {

    static final String DELETE_ACTION = "delete";
    static final String START_ACTION = "start";
    static final String FINISH_ACTION = "finish";
    static final String ABORT_ACTION = "abort";

    public WriteRequest parse(HttpServerRequest request, WriteTarget target) {
        return parse(request.method(), target, request.getParam(HttpPathQueryHelpers.COLLECTION_PARAM),
                request.getParam(HttpPathQueryHelpers.KEY_PARAM), request.params(), request.path());
    }

    public WriteRequest parse(HttpMethod method,
                              WriteTarget target,
                              @Nullable String collectionName,
                              @Nullable String key,
                              MultiMap params,
                              String path) {
        final String action = Strings.emptyToNull(params.get(HttpPathQueryHelpers.ACTION_PARAM));
        switch (target) {
            case PING:
                if (method == HttpMethod.GET && action == null) {
                    return new WriteRequest(RequestKind.RESPOND_TO_PING, null, null, null, null, null);
                }
                break;
            case DATA:
                if (method == HttpMethod.DELETE && action == null
                        || method == HttpMethod.POST && DELETE_ACTION.equals(action)) {
                    return new WriteRequest(RequestKind.DELETE_KEY, required(collectionName, "collection", path),
                            required(key, "key", path), param(params, HttpPathQueryHelpers.VERSION_IDENTIFIER_PARAM),
                            null, null);
                }
                if (method == HttpMethod.POST && action == null) {
                    return parseArchive(collectionName, key, params, path);
                }
                break;
            case CONJOINED:
                if (method == HttpMethod.POST && action != null) {
                    return parseConjoined(action, collectionName, key, params, path);
                }
                break;
            default:
                throw new IllegalStateException("Unknown write target " + target);
        }
        throw new HttpException(ErrorCode.UNPARSABLE_REQUEST,
                "Unsupported request: " + method + (action == null ? "" : " with action '" + action + "'"), path);
    }

    private static WriteRequest parseArchive(@Nullable String collectionName,
                                             @Nullable String key,
                                             MultiMap params,
                                             String path) {
        final String conjoinedIdentifier = param(params, HttpPathQueryHelpers.CONJOINED_IDENTIFIER_PARAM);
        final String partValue = param(params, HttpPathQueryHelpers.CONJOINED_PART_PARAM);
        if ((conjoinedIdentifier == null) != (partValue == null)) {
            throw new HttpException(ErrorCode.UNPARSABLE_REQUEST, "'" + HttpPathQueryHelpers.CONJOINED_IDENTIFIER_PARAM
                    + "' and '" + HttpPathQueryHelpers.CONJOINED_PART_PARAM + "' must be given together", path);
        }
        final Integer part = partValue == null ? null : parsePartNumber(partValue, path);
        return new WriteRequest(RequestKind.ARCHIVE_KEY, required(collectionName, "collection", path),
                required(key, "key", path), null, conjoinedIdentifier, part);
    }

    private static WriteRequest parseConjoined(String action,
                                               @Nullable String collectionName,
                                               @Nullable String key,
                                               MultiMap params,
                                               String path) {
        final RequestKind kind;
        switch (action) {
            case START_ACTION:
                return new WriteRequest(RequestKind.START_CONJOINED, required(collectionName, "collection", path),
                        required(key, "key", path), null, null, null);
            case FINISH_ACTION:
                kind = RequestKind.FINISH_CONJOINED;
                break;
            case ABORT_ACTION:
                kind = RequestKind.ABORT_CONJOINED;
                break;
            default:
                throw new HttpException(ErrorCode.UNPARSABLE_REQUEST, "Unknown action '" + action + "'", path);
        }
        final String conjoinedIdentifier = required(param(params, HttpPathQueryHelpers.CONJOINED_IDENTIFIER_PARAM),
                HttpPathQueryHelpers.CONJOINED_IDENTIFIER_PARAM, path);
        return new WriteRequest(kind, required(collectionName, "collection", path), required(key, "key", path),
                null, conjoinedIdentifier, null);
    }

    private static int parsePartNumber(String value, String path) {
        final int part;
        try {
            part = Integer.parseInt(value);
        } catch (NumberFormatException nfex) {
            throw new HttpException(ErrorCode.UNPARSABLE_REQUEST,
                    "The conjoined part must be an integer (it was '" + value + "')", path, nfex);
        }
        if (part < 1) {
            throw new HttpException(ErrorCode.UNPARSABLE_REQUEST,
                    "The conjoined part must be positive (it was " + part + ")", path);
        }
        return part;
    }

    @Nullable
    private static String param(MultiMap params, String name) {
        return Strings.emptyToNull(params.get(name));
    }

    private static String required(@Nullable String value, String name, String path) {
        if (Strings.isNullOrEmpty(value)) {
            throw new HttpException(ErrorCode.UNPARSABLE_REQUEST, "Missing " + name, path);
        }
        return value;
    }
}
