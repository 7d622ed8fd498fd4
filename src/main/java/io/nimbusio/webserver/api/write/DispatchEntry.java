package io.nimbusio.webserver.api.write;

import com.google.common.base.MoreObjects;
import io.nimbusio.webserver.api.auth.AccessLevel;

/**
 * The handler of a {@link RequestKind} and the access level it requires.
 */
public final class DispatchEntry {

    private final WriteHandler handler;
    private final AccessLevel requiredLevel;

    public DispatchEntry(WriteHandler handler, AccessLevel requiredLevel) {
        this.handler = handler;
        this.requiredLevel = requiredLevel;
    }

    public WriteHandler getHandler() {
        return handler;
    }

    public AccessLevel getRequiredLevel() {
        return requiredLevel;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("handler", handler.getClass().getSimpleName())
                .add("requiredLevel", requiredLevel)
                .toString();
    }
}
