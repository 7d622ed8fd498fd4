package io.nimbusio.webserver.api.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nimbusio.webserver.api.model.ErrorInfo;
import io.nimbusio.webserver.api.model.exceptions.ConjoinedConflictException;
import io.nimbusio.webserver.api.model.exceptions.DependencyUnavailableException;
import io.nimbusio.webserver.api.model.exceptions.InvalidIdentifierException;
import io.nimbusio.webserver.api.model.exceptions.InvalidRangeException;
import io.nimbusio.webserver.api.model.exceptions.InvalidTimestampException;
import io.nimbusio.webserver.api.model.exceptions.NoSuchKeyException;
import io.nimbusio.webserver.api.model.exceptions.RangeNotSatisfiableException;
import io.nimbusio.webserver.api.model.exceptions.RecordedFaultException;
import io.nimbusio.webserver.api.model.exceptions.StorageException;
import io.nimbusio.webserver.api.read.ReadExceptionTranslator;
import io.nimbusio.webserver.api.write.WriteExceptionTranslator;
import io.nimbusio.webserver.util.ObjectMappers;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.concurrent.CompletionException;

/**
 * The read and write APIs report the same failures with different status codes.
 */
class ExceptionTranslatorTest {

    private final ObjectMapper mapper = ObjectMappers.createApiObjectMapper();
    private final ReadExceptionTranslator readTranslator = new ReadExceptionTranslator(mapper);
    private final WriteExceptionTranslator writeTranslator = new WriteExceptionTranslator(mapper);
    private final RoutingContext context = Mockito.mock(RoutingContext.class);

    ExceptionTranslatorTest() {
        final HttpServerRequest request = Mockito.mock(HttpServerRequest.class);
        Mockito.when(request.path()).thenReturn("/c/photos/data/a.jpg");
        Mockito.when(context.request()).thenReturn(request);
    }

    private static ErrorCode translate(JsonExceptionTranslator translator, RoutingContext context, Throwable t) {
        return translator.getErrorCode(translator.rewriteException(context, new CompletionException(t)));
    }

    private ErrorCode read(Throwable t) {
        return translate(readTranslator, context, t);
    }

    private ErrorCode write(Throwable t) {
        return translate(writeTranslator, context, t);
    }

    @Test
    void malformedInputIsUnavailableOnReadAndBadRequestOnWrite() {
        Assertions.assertEquals(ErrorCode.MALFORMED_RANGE, read(new InvalidRangeException("bytes=x")));
        Assertions.assertEquals(ErrorCode.MALFORMED_TIMESTAMP, read(new InvalidTimestampException("yesterday")));
        Assertions.assertEquals(ErrorCode.MALFORMED_IDENTIFIER, read(new InvalidIdentifierException("zz")));
        Assertions.assertEquals(503, readTranslator.getHttpResponseCode(
                readTranslator.rewriteException(context, new InvalidRangeException("bytes=x"))));

        Assertions.assertEquals(ErrorCode.UNPARSABLE_REQUEST, write(new InvalidIdentifierException("zz")));
        Assertions.assertEquals(ErrorCode.UNPARSABLE_REQUEST, write(new InvalidTimestampException("yesterday")));
    }

    @Test
    void dependencyFailures() {
        Assertions.assertEquals(ErrorCode.SERVICE_UNAVAILABLE, read(new DependencyUnavailableException("timeout")));
        Assertions.assertEquals(ErrorCode.SERVICE_UNAVAILABLE, read(new StorageException("disk")));
        Assertions.assertEquals(ErrorCode.DEPENDENCY_FAILURE, write(new DependencyUnavailableException("timeout")));
        Assertions.assertEquals(ErrorCode.DEPENDENCY_FAILURE, write(new StorageException("disk")));
    }

    @Test
    void commonFailuresMapTheSameOnBothApis() {
        for (JsonExceptionTranslator translator : new JsonExceptionTranslator[] {readTranslator, writeTranslator}) {
            Assertions.assertEquals(ErrorCode.NO_SUCH_KEY, translate(translator, context, new NoSuchKeyException("k")));
            Assertions.assertEquals(ErrorCode.CONFLICT,
                    translate(translator, context, new ConjoinedConflictException("done")));
            Assertions.assertEquals(ErrorCode.RANGE_NOT_SATISFIABLE,
                    translate(translator, context, new RangeNotSatisfiableException("past the end")));
            Assertions.assertEquals(ErrorCode.INTERNAL_SERVER_ERROR,
                    translate(translator, context, new RecordedFaultException(new IllegalStateException("gap"))));
            Assertions.assertEquals(ErrorCode.INTERNAL_SERVER_ERROR,
                    translate(translator, context, new IllegalArgumentException("bug")));
        }
    }

    @Test
    void bareStatusCodesAreTranslated() {
        Mockito.when(context.statusCode()).thenReturn(413);
        Assertions.assertEquals(ErrorCode.REQUEST_TOO_LARGE,
                writeTranslator.getErrorCode(writeTranslator.rewriteException(context, null)));
    }

    @Test
    void errorBodiesAreJson() throws Exception {
        final Throwable rewritten = readTranslator.rewriteException(context, new NoSuchKeyException("No such key: a"));
        final ErrorInfo info = mapper.readValue(readTranslator.getResponseErrorMessage(rewritten), ErrorInfo.class);
        Assertions.assertEquals("KeyNotFound", info.getCode());
        Assertions.assertEquals(ContentType.APPLICATION_JSON, readTranslator.getResponseErrorContentType());
    }
}
