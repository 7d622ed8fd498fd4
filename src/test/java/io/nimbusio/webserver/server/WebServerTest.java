package io.nimbusio.webserver.server;

import io.nimbusio.webserver.api.auth.Credentials;
import io.nimbusio.webserver.api.auth.SignatureAuthenticator;
import io.nimbusio.webserver.api.common.CommonHeaders;
import io.nimbusio.webserver.config.WebServerConfiguration;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the read and write servers on ephemeral ports and talks to them over HTTP.
 */
class WebServerTest {

    private static final String HOST = "127.0.0.1";

    private static WebServer server;
    private static Vertx clientVertx;
    private static WebClient client;

    @BeforeAll
    static void setUp() {
        server = new WebServer(WebServerConfiguration.fromResource("/webserver-test.json"));
        server.start();
        clientVertx = Vertx.vertx();
        client = WebClient.create(clientVertx);
    }

    @AfterAll
    static void tearDown() {
        client.close();
        clientVertx.close();
        server.stop();
    }

    /**
     * Send as the proxy in front of the servers would, naming the client in X-Forwarded-For unless the request already
     * does.
     */
    private static HttpResponse<Buffer> send(HttpRequest<Buffer> request, Buffer body) throws Exception {
        if (!request.headers().contains(CommonHeaders.X_FORWARDED_FOR)) {
            request.putHeader(CommonHeaders.X_FORWARDED_FOR, HOST);
        }
        return sendAsIs(request, body);
    }

    private static HttpResponse<Buffer> sendAsIs(HttpRequest<Buffer> request, Buffer body) throws Exception {
        final CompletableFuture<HttpResponse<Buffer>> cf = new CompletableFuture<>();
        request.sendBuffer(body, ar -> {
            if (ar.succeeded()) {
                cf.complete(ar.result());
            } else {
                cf.completeExceptionally(ar.cause());
            }
        });
        return cf.get(30, TimeUnit.SECONDS);
    }

    private static HttpResponse<Buffer> send(HttpRequest<Buffer> request) throws Exception {
        return send(request, Buffer.buffer());
    }

    private static String archive(String collection, String key, String body) throws Exception {
        final HttpResponse<Buffer> response = send(
                client.post(server.getWritePort(), HOST, "/c/" + collection + "/data/" + key), Buffer.buffer(body));
        Assertions.assertEquals(200, response.statusCode(), response.bodyAsString());
        final JsonObject json = response.bodyAsJsonObject();
        Assertions.assertTrue(json.getBoolean("success"));
        return json.getString("version_identifier");
    }

    private static HttpRequest<Buffer> get(String path) {
        return client.get(server.getReadPort(), HOST, path);
    }

    private static void sign(HttpRequest<Buffer> request, String method, String path, String secret) {
        final long timestamp = Instant.now().getEpochSecond();
        request.putHeader(CommonHeaders.TIMESTAMP, Long.toString(timestamp));
        request.putHeader("Authorization", Credentials.SCHEME + " alice-key:"
                + SignatureAuthenticator.sign(secret, "alice", method, timestamp, path));
    }

    @Test
    void bothServersAnswerPings() throws Exception {
        Assertions.assertEquals("ok", send(get("/ping")).bodyAsString());
        Assertions.assertEquals("ok", send(client.get(server.getWritePort(), HOST, "/ping")).bodyAsString());
    }

    /**
     * Health checks never look at the requester headers.
     */
    @Test
    void pingsIgnoreMalformedRequesterHeaders() throws Exception {
        final HttpResponse<Buffer> read = send(get("/ping").putHeader(CommonHeaders.X_FORWARDED_FOR, "not-an-ip"));
        Assertions.assertEquals(200, read.statusCode());
        Assertions.assertEquals("ok", read.bodyAsString());

        final HttpResponse<Buffer> write = send(client.get(server.getWritePort(), HOST, "/ping")
                .putHeader(CommonHeaders.X_FORWARDED_FOR, "not-an-ip")
                .putHeader("Referer", "not a url"));
        Assertions.assertEquals(200, write.statusCode(), write.bodyAsString());
        Assertions.assertEquals("ok", write.bodyAsString());
    }

    @Test
    void collectionRequestsNeedAValidRequester() throws Exception {
        final HttpResponse<Buffer> missing = sendAsIs(get("/c/open/data/anything"), Buffer.buffer());
        Assertions.assertEquals(400, missing.statusCode());
        Assertions.assertEquals("InvalidRequesterAddress", missing.bodyAsJsonObject().getString("code"));

        final HttpResponse<Buffer> missingOnWrite = sendAsIs(
                client.post(server.getWritePort(), HOST, "/c/open/data/anything"), Buffer.buffer("abc"));
        Assertions.assertEquals(400, missingOnWrite.statusCode());

        final HttpResponse<Buffer> badTimestamp = send(get("/c/open/data/anything")
                .putHeader(CommonHeaders.TIMESTAMP, "yesterday"));
        Assertions.assertEquals(400, badTimestamp.statusCode());
    }

    @Test
    void archiveThenRetrieve() throws Exception {
        final String versionId = archive("open", "digits.txt", "0123456789");
        Assertions.assertNotNull(versionId);

        final HttpResponse<Buffer> response = send(get("/c/open/data/digits.txt"));
        Assertions.assertEquals(200, response.statusCode());
        Assertions.assertEquals("0123456789", response.bodyAsString());
        Assertions.assertEquals("10", response.getHeader("Content-Length"));
        Assertions.assertNotNull(response.getHeader("Last-Modified"));
    }

    @Test
    void rangesAreServedAsPartialContent() throws Exception {
        archive("open", "range.txt", "0123456789");

        final HttpResponse<Buffer> response = send(get("/c/open/data/range.txt").putHeader("Range", "bytes=2-5"));

        Assertions.assertEquals(206, response.statusCode());
        Assertions.assertEquals("bytes 2-5/10", response.getHeader("Content-Range"));
        Assertions.assertEquals("2345", response.bodyAsString());
    }

    @Test
    void unsatisfiableAndMalformedRanges() throws Exception {
        archive("open", "short.txt", "abc");

        Assertions.assertEquals(416,
                send(get("/c/open/data/short.txt").putHeader("Range", "bytes=3-")).statusCode());
        Assertions.assertEquals(503,
                send(get("/c/open/data/short.txt").putHeader("Range", "bytes=a-b")).statusCode());
    }

    @Test
    void conditionalRequests() throws Exception {
        archive("open", "cond.txt", "abc");

        final HttpResponse<Buffer> notModified = send(get("/c/open/data/cond.txt")
                .putHeader("If-Modified-Since", "Fri, 01 Jan 2100 00:00:00 GMT"));
        Assertions.assertEquals(304, notModified.statusCode());

        final HttpResponse<Buffer> failed = send(get("/c/open/data/cond.txt")
                .putHeader("If-Unmodified-Since", "Thu, 01 Jan 1970 00:00:00 GMT"));
        Assertions.assertEquals(412, failed.statusCode());
    }

    @Test
    void missingKeysAndCollectionsAreNotFound() throws Exception {
        Assertions.assertEquals(404, send(get("/c/open/data/never-written")).statusCode());
        Assertions.assertEquals(404, send(get("/c/no-such-collection/data/x")).statusCode());
        Assertions.assertEquals(404, send(get("/unknown")).statusCode());
    }

    @Test
    void deletedKeysAreNotFound() throws Exception {
        archive("open", "doomed.txt", "abc");

        final HttpResponse<Buffer> deleted = send(
                client.delete(server.getWritePort(), HOST, "/c/open/data/doomed.txt"));
        Assertions.assertEquals(200, deleted.statusCode());
        Assertions.assertEquals(404, send(get("/c/open/data/doomed.txt")).statusCode());
    }

    @Test
    void oversizedBodiesAreRejected() throws Exception {
        final HttpResponse<Buffer> response = send(
                client.post(server.getWritePort(), HOST, "/c/open/data/big.bin"), Buffer.buffer(new byte[2048]));
        Assertions.assertEquals(413, response.statusCode());
    }

    @Test
    void unsupportedWritesAreUnparsable() throws Exception {
        final HttpResponse<Buffer> response = send(
                client.put(server.getWritePort(), HOST, "/c/open/data/x.txt"), Buffer.buffer("abc"));
        Assertions.assertEquals(400, response.statusCode());
    }

    /**
     * A collection without access control needs a signed request.
     */
    @Test
    void privateCollectionsNeedSignedRequests() throws Exception {
        final String path = "/c/private/data/secret.txt";

        final HttpResponse<Buffer> anonymous = send(get(path));
        Assertions.assertEquals(401, anonymous.statusCode());
        Assertions.assertNotNull(anonymous.getHeader("WWW-Authenticate"));

        final HttpRequest<Buffer> write = client.post(server.getWritePort(), HOST, path);
        sign(write, "POST", path, "alice-secret");
        Assertions.assertEquals(200, send(write, Buffer.buffer("hush")).statusCode());

        final HttpRequest<Buffer> read = get(path);
        sign(read, "GET", path, "alice-secret");
        final HttpResponse<Buffer> response = send(read);
        Assertions.assertEquals(200, response.statusCode());
        Assertions.assertEquals("hush", response.bodyAsString());

        final HttpRequest<Buffer> forged = get(path);
        sign(forged, "GET", path, "not-the-secret");
        Assertions.assertEquals(403, send(forged).statusCode());
    }

    @Test
    void conjoinedUploads() throws Exception {
        final HttpResponse<Buffer> started = send(
                client.post(server.getWritePort(), HOST, "/c/open/conjoined/joined.txt").addQueryParam("action", "start"));
        Assertions.assertEquals(200, started.statusCode(), started.bodyAsString());
        final String id = started.bodyAsJsonObject().getString("conjoined_identifier");

        for (int part = 1; part <= 2; part++) {
            final HttpResponse<Buffer> uploaded = send(client.post(server.getWritePort(), HOST, "/c/open/data/joined.txt")
                    .addQueryParam("conjoined_identifier", id)
                    .addQueryParam("conjoined_part", Integer.toString(part)), Buffer.buffer("part" + part));
            Assertions.assertEquals(200, uploaded.statusCode(), uploaded.bodyAsString());
        }

        final HttpResponse<Buffer> finished = send(
                client.post(server.getWritePort(), HOST, "/c/open/conjoined/joined.txt")
                        .addQueryParam("action", "finish")
                        .addQueryParam("conjoined_identifier", id));
        Assertions.assertEquals(200, finished.statusCode(), finished.bodyAsString());
        Assertions.assertEquals("part1part2", send(get("/c/open/data/joined.txt")).bodyAsString());

        final HttpResponse<Buffer> again = send(
                client.post(server.getWritePort(), HOST, "/c/open/conjoined/joined.txt")
                        .addQueryParam("action", "abort")
                        .addQueryParam("conjoined_identifier", id));
        Assertions.assertEquals(409, again.statusCode());
    }

    @Test
    void listsKeysAsJson() throws Exception {
        archive("open", "list/a.txt", "a");
        archive("open", "list/b.txt", "b");

        final HttpResponse<Buffer> response = send(get("/c/open/data/").addQueryParam("prefix", "list/"));

        Assertions.assertEquals(200, response.statusCode());
        Assertions.assertEquals(2, response.bodyAsJsonObject().getJsonArray("key_data").size());
    }
}
