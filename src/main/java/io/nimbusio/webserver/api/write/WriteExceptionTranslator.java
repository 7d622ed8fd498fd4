package io.nimbusio.webserver.api.write;

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
 * Error translation for the write API: malformed input is a 400 and collaborator failures are a 500.
 */
public class WriteExceptionTranslator extends JsonExceptionTranslator {

    public WriteExceptionTranslator(ObjectMapper mapper) {
        super(mapper);
    }

    @Override
    protected Optional<HttpException> rewriteApiException(String path, Throwable throwable) {
        if (throwable instanceof InvalidIdentifierException
                || throwable instanceof InvalidRangeException
                || throwable instanceof InvalidTimestampException) {
            return Optional.of(new HttpException(ErrorCode.UNPARSABLE_REQUEST, path, throwable));
        }
        if (throwable instanceof DependencyUnavailableException || throwable instanceof StorageException) {
            return Optional.of(new HttpException(ErrorCode.DEPENDENCY_FAILURE, path, throwable));
        }
        return Optional.empty();
    }
}
