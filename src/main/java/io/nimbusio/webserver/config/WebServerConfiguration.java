package io.nimbusio.webserver.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.nimbusio.webserver.util.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

/**
 * Configuration for the read and write web servers.
 *
 * The configuration is a JSON document. {@link #load()} reads the file named by the {@value #CONFIG_PROPERTY} system
 * property if it is set, and the {@value #DEFAULT_RESOURCE} classpath resource otherwise.
 */
public final class WebServerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(WebServerConfiguration.class);

    public static final String CONFIG_PROPERTY = "webserver.config";
    public static final String DEFAULT_RESOURCE = "/webserver.json";

    @JsonProperty("host")
    private String host = "0.0.0.0";

    @JsonProperty("readPort")
    private int readPort = 8088;

    @JsonProperty("writePort")
    private int writePort = 8089;

    @JsonProperty("verticleInstances")
    private int verticleInstances = Runtime.getRuntime().availableProcessors();

    @JsonProperty("nodeName")
    private String nodeName = "node-00";

    @JsonProperty("shardId")
    private long shardId = 0;

    @JsonProperty("chunkSize")
    private int chunkSize = 64 * 1024;

    @JsonProperty("segmentSize")
    private int segmentSize = 1024 * 1024;

    @JsonProperty("maxArchiveSize")
    private long maxArchiveSize = 64L * 1024 * 1024;

    @JsonProperty("dependencyTimeout")
    private Duration dependencyTimeout = Duration.ofMinutes(5);

    @JsonProperty("dependencyPoolSize")
    private int dependencyPoolSize = 64;

    @JsonProperty("dependencyQueueSize")
    private int dependencyQueueSize = 1024;

    @JsonProperty("closeTimeout")
    private Duration closeTimeout = Duration.ofSeconds(5);

    @JsonProperty("httpServerIdleTimeout")
    private Duration httpServerIdleTimeout = Duration.ofSeconds(60);

    @JsonProperty("maxClockSkew")
    private Duration maxClockSkew = Duration.ofMinutes(10);

    @JsonProperty("identifierKeys")
    private IdentifierKeysConfiguration identifierKeys;

    @JsonProperty("collections")
    private List<CollectionSeed> collections = ImmutableList.of();

    @JsonProperty("customerKeys")
    private List<CustomerKeySeed> customerKeys = ImmutableList.of();

    public static WebServerConfiguration load() {
        final String path = System.getProperty(CONFIG_PROPERTY);
        if (path != null) {
            return fromFile(Paths.get(path));
        }
        return fromResource(DEFAULT_RESOURCE);
    }

    public static WebServerConfiguration fromFile(Path path) {
        LOG.info("Loading web server configuration from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read web server configuration from " + path, e);
        }
    }

    public static WebServerConfiguration fromResource(String resource) {
        LOG.info("Loading web server configuration from classpath resource {}", resource);
        try (InputStream in = WebServerConfiguration.class.getResourceAsStream(resource)) {
            Preconditions.checkArgument(in != null, "Missing configuration resource %s", resource);
            return parse(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read web server configuration resource " + resource, e);
        }
    }

    private static WebServerConfiguration parse(InputStream in) throws IOException {
        final ObjectMapper mapper = ObjectMappers.createConfigObjectMapper();
        final WebServerConfiguration config = mapper.readValue(in, WebServerConfiguration.class);
        config.validate();
        return config;
    }

    private void validate() {
        Preconditions.checkState(identifierKeys != null, "identifierKeys must be configured");
        Preconditions.checkState(verticleInstances > 0, "verticleInstances must be positive");
        Preconditions.checkState(verticleInstances == 1 || readPort != 0 && writePort != 0,
                "ephemeral ports need a single verticle instance");
        Preconditions.checkState(chunkSize > 0, "chunkSize must be positive");
        Preconditions.checkState(segmentSize > 0, "segmentSize must be positive");
        Preconditions.checkState(!dependencyTimeout.isNegative() && !dependencyTimeout.isZero(),
                "dependencyTimeout must be positive");
    }

    public String getHost() {
        return host;
    }

    public int getReadPort() {
        return readPort;
    }

    public int getWritePort() {
        return writePort;
    }

    public int getVerticleInstances() {
        return verticleInstances;
    }

    public String getNodeName() {
        return nodeName;
    }

    public long getShardId() {
        return shardId;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getSegmentSize() {
        return segmentSize;
    }

    public long getMaxArchiveSize() {
        return maxArchiveSize;
    }

    public Duration getDependencyTimeout() {
        return dependencyTimeout;
    }

    public int getDependencyPoolSize() {
        return dependencyPoolSize;
    }

    public int getDependencyQueueSize() {
        return dependencyQueueSize;
    }

    public Duration getCloseTimeout() {
        return closeTimeout;
    }

    public Duration getHttpServerIdleTimeout() {
        return httpServerIdleTimeout;
    }

    public Duration getMaxClockSkew() {
        return maxClockSkew;
    }

    public IdentifierKeysConfiguration getIdentifierKeys() {
        return identifierKeys;
    }

    public List<CollectionSeed> getCollections() {
        return collections;
    }

    public List<CustomerKeySeed> getCustomerKeys() {
        return customerKeys;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("host", host)
                .add("readPort", readPort)
                .add("writePort", writePort)
                .add("verticleInstances", verticleInstances)
                .add("nodeName", nodeName)
                .add("shardId", shardId)
                .add("chunkSize", chunkSize)
                .add("segmentSize", segmentSize)
                .add("dependencyTimeout", dependencyTimeout)
                .add("identifierKeys", identifierKeys)
                .add("collections", collections)
                .toString();
    }
}
