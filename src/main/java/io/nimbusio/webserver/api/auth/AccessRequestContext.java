package io.nimbusio.webserver.api.auth;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import javax.annotation.Nullable;
import java.net.InetAddress;
import java.util.Optional;

/**
 * What the evaluator knows about a request: where it came from, the host of its referer if it had one, and the
 * collection-relative path of the resource it addresses.
 */
public final class AccessRequestContext {

    private final InetAddress requesterAddress;
    @Nullable
    private final String refererHost;
    private final String resourcePath;

    public AccessRequestContext(InetAddress requesterAddress, @Nullable String refererHost, String resourcePath) {
        this.requesterAddress = Preconditions.checkNotNull(requesterAddress);
        this.refererHost = refererHost;
        this.resourcePath = Preconditions.checkNotNull(resourcePath);
    }

    public InetAddress getRequesterAddress() {
        return requesterAddress;
    }

    public Optional<String> getRefererHost() {
        return Optional.ofNullable(refererHost);
    }

    public String getResourcePath() {
        return resourcePath;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("requesterAddress", requesterAddress.getHostAddress())
                .add("refererHost", refererHost)
                .add("resourcePath", resourcePath)
                .toString();
    }
}
