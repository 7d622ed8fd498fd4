package io.nimbusio.webserver.api.common;

import com.google.common.base.Preconditions;
import io.nimbusio.webserver.api.model.exceptions.ConjoinedConflictException;
import io.nimbusio.webserver.api.model.exceptions.NoSuchCollectionException;
import io.nimbusio.webserver.api.model.exceptions.NoSuchConjoinedException;
import io.nimbusio.webserver.api.model.exceptions.NoSuchKeyException;
import io.nimbusio.webserver.api.model.exceptions.RangeNotSatisfiableException;
import io.nimbusio.webserver.util.ThrowableUtil;
import io.vertx.core.http.HttpServerRequest;

import javax.annotation.Nullable;
import java.util.concurrent.CompletionException;

/**
 * Http exception contains an error code, and the resource path.
 * It is used for returning error response to http requests.
 */
public final class HttpException extends RuntimeException {
    private final ErrorCode errorCode;
    private final String resourcePath;

    public HttpException(ErrorCode errorCode, String message, String resourcePath, @Nullable Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.resourcePath = resourcePath;
    }

    public HttpException(ErrorCode errorCode, String message, String resourcePath) {
        this(errorCode, message, resourcePath, null);
    }

    public HttpException(ErrorCode errorCode, String resourcePath, Throwable cause) {
        this(errorCode, cause.getMessage(), resourcePath, cause);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public CharSequence getResourcePath() {
        return resourcePath;
    }

    public static <T> T handle(HttpServerRequest request, @Nullable T val, Throwable thrown) {
        if (thrown == null) {
            return val;
        }
        throw rewrite(request, thrown);
    }

    /**
     * Rewrite the exceptions whose HTTP meaning is the same on every API. Anything else is returned wrapped in a
     * CompletionException for the API specific translator to deal with.
     */
    public static RuntimeException rewrite(HttpServerRequest request, Throwable thrown) {
        thrown = ThrowableUtil.getUnderlyingThrowable(Preconditions.checkNotNull(thrown));
        if (thrown instanceof HttpException) {
            return (HttpException) thrown;
        }

        final String path = request.path();

        if (thrown instanceof NoSuchCollectionException) {
            return new HttpException(ErrorCode.NO_SUCH_COLLECTION, path, thrown);
        }

        if (thrown instanceof NoSuchKeyException) {
            return new HttpException(ErrorCode.NO_SUCH_KEY, path, thrown);
        }

        if (thrown instanceof NoSuchConjoinedException) {
            return new HttpException(ErrorCode.NO_SUCH_CONJOINED, path, thrown);
        }

        if (thrown instanceof ConjoinedConflictException) {
            return new HttpException(ErrorCode.CONFLICT, path, thrown);
        }

        if (thrown instanceof RangeNotSatisfiableException) {
            return new HttpException(ErrorCode.RANGE_NOT_SATISFIABLE, path, thrown);
        }

        return new CompletionException(thrown);
    }
}
