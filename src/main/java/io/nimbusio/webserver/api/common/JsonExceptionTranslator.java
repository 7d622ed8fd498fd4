package io.nimbusio.webserver.api.common;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nimbusio.webserver.api.model.ErrorInfo;
import io.nimbusio.webserver.api.model.exceptions.RecordedFaultException;
import io.nimbusio.webserver.util.ThrowableUtil;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Optional;

/**
 * Writes out {@link HttpException} exceptions using {@link ErrorInfo} as the JSON format.
 *
 * Subclasses decide how the exceptions whose status differs between the read and write APIs are reported. Any
 * exception that is still not an {@link HttpException} after rewriting is written out as an internal server error
 * (status 500).
 */
public abstract class JsonExceptionTranslator implements WSExceptionTranslator {
    private static final Logger LOG = LoggerFactory.getLogger(JsonExceptionTranslator.class);

    private final ObjectMapper mapper;

    protected JsonExceptionTranslator(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Rewrite exceptions with an API specific meaning.
     *
     * @param path      the path of the failed request
     * @param throwable the unwrapped throwable
     * @return the rewritten exception, or empty to fall back to the common rewriting in {@link HttpException}
     */
    protected abstract Optional<HttpException> rewriteApiException(String path, Throwable throwable);

    @Override
    public Throwable rewriteException(RoutingContext context, @Nullable Throwable throwable) {
        final String path = context.request().path();
        if (throwable == null) {
            final int statusCode = context.statusCode();
            if (statusCode > 0) {
                return new HttpException(ErrorCode.forStatusCode(statusCode),
                        "Request failed with status " + statusCode, path);
            }
            return new HttpException(ErrorCode.INTERNAL_SERVER_ERROR,
                    "Context failed without throwable; see status code", path);
        }

        final Throwable underlying = ThrowableUtil.getUnderlyingThrowable(throwable);
        if (underlying instanceof RecordedFaultException) {
            return new HttpException(ErrorCode.INTERNAL_SERVER_ERROR, "Internal server error", path, underlying);
        }

        final Optional<HttpException> rewritten = rewriteApiException(path, underlying);
        if (rewritten.isPresent()) {
            return rewritten.get();
        }

        final RuntimeException common = HttpException.rewrite(context.request(), underlying);
        return common instanceof HttpException ? common : underlying;
    }

    @Override
    public int getHttpResponseCode(@Nonnull Throwable throwable) {
        return getErrorCode(throwable).getStatusCode();
    }

    @Override
    public String getResponseErrorContentType() {
        return ContentType.APPLICATION_JSON;
    }

    @Override
    public String getResponseErrorMessage(@Nonnull Throwable throwable) {
        final ErrorInfo errorInfo;
        if (throwable instanceof HttpException) {
            final HttpException hex = (HttpException) throwable;
            errorInfo = new ErrorInfo(hex.getErrorCode().getErrorName(), hex.getMessage());
        } else {
            errorInfo = new ErrorInfo(ErrorCode.INTERNAL_SERVER_ERROR.getErrorName(), "Internal server error");
        }
        try {
            return mapper.writeValueAsString(errorInfo);
        } catch (JsonProcessingException jpex) {
            LOG.warn("Failed to serialize error info as JSON: {}", errorInfo, jpex);
            return "";
        }
    }

    @Override
    public void writeResponseErrorHeaders(@Nonnull RoutingContext routingContext, int statusCode) {
        final HttpServerResponse response = routingContext.response();

        if (statusCode == HttpResponseStatus.UNAUTHORIZED) {
            response.putHeader("WWW-Authenticate", "NIMBUS.IO realm=\"nimbus.io\"");
        }
    }

    @Override
    public ErrorCode getErrorCode(@Nonnull Throwable throwable) {
        if (throwable instanceof HttpException) {
            final HttpException hex = (HttpException) throwable;
            return hex.getErrorCode();
        }
        return ErrorCode.INTERNAL_SERVER_ERROR;
    }
}
