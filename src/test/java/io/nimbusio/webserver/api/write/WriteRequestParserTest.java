package io.nimbusio.webserver.api.write;

import io.nimbusio.webserver.api.common.ErrorCode;
import io.nimbusio.webserver.api.common.HttpException;
import io.vertx.core.MultiMap;
import io.vertx.core.http.HttpMethod;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class WriteRequestParserTest {

    private static final String PATH = "/c/photos/data/a.jpg";

    private final WriteRequestParser parser = new WriteRequestParser();

    private static MultiMap params(String... namesAndValues) {
        final MultiMap params = MultiMap.caseInsensitiveMultiMap();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            params.add(namesAndValues[i], namesAndValues[i + 1]);
        }
        return params;
    }

    private WriteRequest parseData(HttpMethod method, MultiMap params) {
        return parser.parse(method, WriteTarget.DATA, "photos", "a.jpg", params, PATH);
    }

    private WriteRequest parseConjoined(MultiMap params) {
        return parser.parse(HttpMethod.POST, WriteTarget.CONJOINED, "photos", "a.jpg", params, PATH);
    }

    private static void assertUnparsable(Runnable parse) {
        final HttpException e = Assertions.assertThrows(HttpException.class, parse::run);
        Assertions.assertEquals(ErrorCode.UNPARSABLE_REQUEST, e.getErrorCode());
    }

    @Test
    void ping() {
        final WriteRequest request = parser.parse(HttpMethod.GET, WriteTarget.PING, null, null, params(), "/ping");
        Assertions.assertEquals(RequestKind.RESPOND_TO_PING, request.getKind());
        Assertions.assertFalse(request.getCollectionName().isPresent());
        assertUnparsable(() -> parser.parse(HttpMethod.POST, WriteTarget.PING, null, null, params(), "/ping"));
    }

    @Test
    void archive() {
        final WriteRequest request = parseData(HttpMethod.POST, params());
        Assertions.assertEquals(RequestKind.ARCHIVE_KEY, request.getKind());
        Assertions.assertEquals("photos", request.getCollectionName().get());
        Assertions.assertEquals("a.jpg", request.getKey());
        Assertions.assertNull(request.getConjoinedIdentifier());
        Assertions.assertNull(request.getConjoinedPart());
    }

    @Test
    void archiveOfAConjoinedPart() {
        final WriteRequest request = parseData(HttpMethod.POST,
                params("conjoined_identifier", "abc", "conjoined_part", "3"));
        Assertions.assertEquals(RequestKind.ARCHIVE_KEY, request.getKind());
        Assertions.assertEquals("abc", request.getConjoinedIdentifier());
        Assertions.assertEquals(Integer.valueOf(3), request.getConjoinedPart());
    }

    @Test
    void conjoinedPartsNeedBothParameters() {
        assertUnparsable(() -> parseData(HttpMethod.POST, params("conjoined_identifier", "abc")));
        assertUnparsable(() -> parseData(HttpMethod.POST, params("conjoined_part", "1")));
        assertUnparsable(() -> parseData(HttpMethod.POST, params("conjoined_identifier", "abc", "conjoined_part", "0")));
        assertUnparsable(() -> parseData(HttpMethod.POST, params("conjoined_identifier", "abc", "conjoined_part", "x")));
    }

    /**
     * Deletes come either as a DELETE or as a POST with action=delete.
     */
    @Test
    void delete() {
        Assertions.assertEquals(RequestKind.DELETE_KEY, parseData(HttpMethod.DELETE, params()).getKind());

        final WriteRequest request = parseData(HttpMethod.POST,
                params("action", "delete", "version_identifier", "v1"));
        Assertions.assertEquals(RequestKind.DELETE_KEY, request.getKind());
        Assertions.assertEquals("v1", request.getVersionIdentifier());
    }

    @Test
    void conjoinedActions() {
        Assertions.assertEquals(RequestKind.START_CONJOINED, parseConjoined(params("action", "start")).getKind());

        final WriteRequest finish = parseConjoined(params("action", "finish", "conjoined_identifier", "abc"));
        Assertions.assertEquals(RequestKind.FINISH_CONJOINED, finish.getKind());
        Assertions.assertEquals("abc", finish.getConjoinedIdentifier());

        final WriteRequest abort = parseConjoined(params("action", "abort", "conjoined_identifier", "abc"));
        Assertions.assertEquals(RequestKind.ABORT_CONJOINED, abort.getKind());
    }

    @Test
    void finishAndAbortNeedAnIdentifier() {
        assertUnparsable(() -> parseConjoined(params("action", "finish")));
        assertUnparsable(() -> parseConjoined(params("action", "abort", "conjoined_identifier", "")));
    }

    @Test
    void unknownCombinationsAreUnparsable() {
        assertUnparsable(() -> parseData(HttpMethod.PUT, params()));
        assertUnparsable(() -> parseData(HttpMethod.POST, params("action", "rename")));
        assertUnparsable(() -> parseData(HttpMethod.DELETE, params("action", "delete")));
        assertUnparsable(() -> parseConjoined(params()));
        assertUnparsable(() -> parseConjoined(params("action", "restart")));
        assertUnparsable(() -> parser.parse(HttpMethod.GET, WriteTarget.CONJOINED, "photos", "a.jpg",
                params("action", "start"), PATH));
    }
}
