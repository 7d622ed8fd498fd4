package io.nimbusio.webserver.api.read;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nimbusio.webserver.api.common.ErrorCode;
import io.nimbusio.webserver.api.common.HttpException;
import io.nimbusio.webserver.api.common.JsonExceptionTranslator;
import io.nimbusio.webserver.api.model.exceptions.DependencyUnavailableException;
import io.nimbusio.webserver.api.model.exceptions.InvalidIdentifierException;
import io.nimbusio.webserver.api.model.exceptions.InvalidRangeException;
import io.nimbusio.webserver.api.model.exceptions.InvalidTimestampException;
import io.nimbusio.webserver.api.model.exceptions.StorageException;

import java.util.Optional;

/**
 * Error translation for the read API. Malformed Range headers, HTTP dates and identifiers are reported with a 503,
 * like an unavailable dependency.
 */
public class ReadExceptionTranslator extends JsonExceptionTranslator {

    public ReadExceptionTranslator(ObjectMapper mapper) {
        super(mapper);
    }

    @Override
    protected Optional<HttpException> rewriteApiException(String path, Throwable throwable) {
        if (throwable instanceof InvalidRangeException) {
            return Optional.of(new HttpException(ErrorCode.MALFORMED_RANGE, path, throwable));
        }
        if (throwable instanceof InvalidTimestampException) {
            return Optional.of(new HttpException(ErrorCode.MALFORMED_TIMESTAMP, path, throwable));
        }
        if (throwable instanceof InvalidIdentifierException) {
            return Optional.of(new HttpException(ErrorCode.MALFORMED_IDENTIFIER, path, throwable));
        }
        if (throwable instanceof DependencyUnavailableException || throwable instanceof StorageException) {
            return Optional.of(new HttpException(ErrorCode.SERVICE_UNAVAILABLE, path, throwable));
        }
        return Optional.empty();
    }
}
