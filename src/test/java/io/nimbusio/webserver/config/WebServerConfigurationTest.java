package io.nimbusio.webserver.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

class WebServerConfigurationTest {

    private static final String KEYS = "\"identifierKeys\": {\"cipherKey\": \"2b7e151628aed2a6abf7158809cf4f3c\", "
            + "\"hmacKey\": \"00112233\", \"hmacSize\": 16}";

    @TempDir
    Path tempDir;

    private Path write(String json) throws IOException {
        final Path file = tempDir.resolve("webserver.json");
        Files.write(file, json.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void loadsTheTestResource() {
        final WebServerConfiguration config = WebServerConfiguration.fromResource("/webserver-test.json");

        Assertions.assertEquals("127.0.0.1", config.getHost());
        Assertions.assertEquals(0, config.getReadPort());
        Assertions.assertEquals(1, config.getVerticleInstances());
        Assertions.assertEquals(Duration.ofSeconds(10), config.getDependencyTimeout());
        Assertions.assertEquals(2, config.getCollections().size());
        Assertions.assertEquals("open", config.getCollections().get(0).getName());
        Assertions.assertNotNull(config.getCollections().get(0).getAccessControl());
        Assertions.assertNull(config.getCollections().get(1).getAccessControl());
        Assertions.assertEquals("alice-key", config.getCustomerKeys().get(0).getKeyId());
    }

    /**
     * Settings left out of the file keep their defaults, and unknown ones are ignored.
     */
    @Test
    void missingSettingsUseDefaults() throws IOException {
        final WebServerConfiguration config = WebServerConfiguration.fromFile(
                write("{" + KEYS + ", \"someFutureSetting\": true}"));

        Assertions.assertEquals(8088, config.getReadPort());
        Assertions.assertEquals(8089, config.getWritePort());
        Assertions.assertEquals(Duration.ofMinutes(5), config.getDependencyTimeout());
        Assertions.assertTrue(config.getCollections().isEmpty());
    }

    @Test
    void identifierKeysAreRequired() throws IOException {
        final Path file = write("{\"readPort\": 9000}");
        Assertions.assertThrows(IllegalStateException.class, () -> WebServerConfiguration.fromFile(file));
    }

    @Test
    void ephemeralPortsNeedASingleVerticle() throws IOException {
        final Path file = write("{" + KEYS + ", \"readPort\": 0, \"verticleInstances\": 2}");
        Assertions.assertThrows(IllegalStateException.class, () -> WebServerConfiguration.fromFile(file));
    }

    @Test
    void missingResourcesAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> WebServerConfiguration.fromResource("/no-such-config.json"));
    }
}
