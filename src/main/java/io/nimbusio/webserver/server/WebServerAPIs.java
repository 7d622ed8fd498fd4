package io.nimbusio.webserver.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nimbusio.webserver.api.common.CommonHandler;
import io.nimbusio.webserver.api.common.FailureHandler;
import io.nimbusio.webserver.api.common.NotFoundHandler;
import io.nimbusio.webserver.api.common.PingHandler;
import io.nimbusio.webserver.api.eventing.EventPublisher;
import io.nimbusio.webserver.api.read.GetObjectHandler;
import io.nimbusio.webserver.api.read.GetUsageHandler;
import io.nimbusio.webserver.api.read.HeadObjectHandler;
import io.nimbusio.webserver.api.read.ListConjoinedHandler;
import io.nimbusio.webserver.api.read.ListKeysHandler;
import io.nimbusio.webserver.api.read.ListUploadsHandler;
import io.nimbusio.webserver.api.read.ListVersionsHandler;
import io.nimbusio.webserver.api.read.ObjectMetaHandler;
import io.nimbusio.webserver.api.read.ReadApi;
import io.nimbusio.webserver.api.read.ReadExceptionTranslator;
import io.nimbusio.webserver.api.read.ReadObjectHelper;
import io.nimbusio.webserver.api.write.ArchiveKeyHandler;
import io.nimbusio.webserver.api.write.ConjoinedActionHandler;
import io.nimbusio.webserver.api.write.DeleteKeyHandler;
import io.nimbusio.webserver.api.write.WriteApi;
import io.nimbusio.webserver.api.write.WriteExceptionTranslator;
import io.nimbusio.webserver.api.write.WriteRequestParser;
import io.nimbusio.webserver.config.WebServerConfiguration;
import io.nimbusio.webserver.util.WebServerMetrics;

/**
 * Builds the read and write APIs and their handlers.
 */
public final class WebServerAPIs {

    private final ReadApi readApi;
    private final WriteApi writeApi;

    public WebServerAPIs(WebServerConfiguration config,
                         WebServerBackends backends,
                         EventPublisher eventPublisher,
                         ObjectMapper mapper) {
        final PingHandler pingHandler = new PingHandler();
        final NotFoundHandler notFoundHandler = new NotFoundHandler();
        final ReadObjectHelper readObjectHelper =
                new ReadObjectHelper(backends.getAuthorizationGate(), backends.getRetrievalEngine());

        readApi = new ReadApi(
                pingHandler,
                new ObjectMetaHandler(backends.getAuthorizationGate(), backends.getRetrievalEngine(), mapper),
                new GetObjectHandler(readObjectHelper),
                new HeadObjectHandler(readObjectHelper),
                new ListKeysHandler(backends.getAuthorizationGate(), backends.getListingBackend(), mapper),
                new ListVersionsHandler(backends.getAuthorizationGate(), backends.getListingBackend(), mapper),
                new ListConjoinedHandler(backends.getAuthorizationGate(), backends.getConjoinedArchiveManager(),
                        mapper),
                new ListUploadsHandler(backends.getAuthorizationGate(), backends.getConjoinedArchiveManager(), mapper),
                new GetUsageHandler(backends.getAuthorizationGate(), backends.getListingBackend(), mapper),
                new CommonHandler(WebServerMetrics.READ_REQUESTS),
                new FailureHandler(new ReadExceptionTranslator(mapper), eventPublisher, config.getCloseTimeout()),
                notFoundHandler);

        writeApi = new WriteApi(
                pingHandler,
                new ArchiveKeyHandler(backends.getArchiveWriter(), mapper),
                new DeleteKeyHandler(backends.getArchiveWriter(), mapper),
                new ConjoinedActionHandler(backends.getConjoinedArchiveManager(), mapper),
                new WriteRequestParser(),
                backends.getAuthorizationGate(),
                new CommonHandler(WebServerMetrics.WRITE_REQUESTS),
                new FailureHandler(new WriteExceptionTranslator(mapper), eventPublisher, config.getCloseTimeout()),
                notFoundHandler,
                config.getMaxArchiveSize());
    }

    public ReadApi getReadApi() {
        return readApi;
    }

    public WriteApi getWriteApi() {
        return writeApi;
    }
}
