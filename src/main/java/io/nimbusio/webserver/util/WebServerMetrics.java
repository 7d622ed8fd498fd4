package io.nimbusio.webserver.util;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;

/**
 * The metrics published by the web servers.
 */
public final class WebServerMetrics {

    public static final MetricRegistry REGISTRY = new MetricRegistry();

    public static final Meter READ_REQUESTS = REGISTRY.meter("ws.read.requests");
    public static final Meter WRITE_REQUESTS = REGISTRY.meter("ws.write.requests");
    public static final Meter CLIENT_ERRORS = REGISTRY.meter("ws.errors.client");
    public static final Meter SERVER_ERRORS = REGISTRY.meter("ws.errors.server");

    public static final Meter ARCHIVES = REGISTRY.meter("ws.write.archives");
    public static final Meter DELETES = REGISTRY.meter("ws.write.deletes");
    public static final Histogram ARCHIVE_SIZE = REGISTRY.histogram("ws.write.archive.size");

    public static final Counter ACTIVE_RETRIEVALS = REGISTRY.counter("ws.read.retrievals.active");
    public static final Meter BYTES_RETRIEVED = REGISTRY.meter("ws.read.bytes");
    public static final Meter NOT_MODIFIED = REGISTRY.meter("ws.read.notModified");
    public static final Meter PRECONDITION_FAILED = REGISTRY.meter("ws.read.preconditionFailed");

    public static final Meter ACCESS_GRANTED = REGISTRY.meter("ws.auth.granted");
    public static final Meter ACCESS_DENIED = REGISTRY.meter("ws.auth.denied");
    public static final Meter DEPENDENCY_TIMEOUTS = REGISTRY.meter("ws.dependency.timeouts");
    public static final Meter DEPENDENCY_FAILURES = REGISTRY.meter("ws.dependency.failures");

    private WebServerMetrics() {

    }
}
