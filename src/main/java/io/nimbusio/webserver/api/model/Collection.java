package io.nimbusio.webserver.api.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * A named collection of keys, owned by one customer.
 *
 * The access control document is kept in its stored (JSON) form; it is parsed for every authorization decision so
 * that policy changes take effect immediately.
 */
public final class Collection {

    private final long id;
    private final String name;
    private final String owner;
    private final boolean versioning;
    @Nullable
    private final String accessControl;

    public Collection(long id, String name, String owner, boolean versioning, @Nullable String accessControl) {
        this.id = id;
        this.name = Preconditions.checkNotNull(name);
        this.owner = Preconditions.checkNotNull(owner);
        this.versioning = versioning;
        this.accessControl = accessControl;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getOwner() {
        return owner;
    }

    public boolean isVersioning() {
        return versioning;
    }

    public Optional<String> getAccessControl() {
        return Optional.ofNullable(accessControl);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Collection that = (Collection) o;
        return id == that.id &&
                versioning == that.versioning &&
                name.equals(that.name) &&
                owner.equals(that.owner) &&
                Objects.equals(accessControl, that.accessControl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, owner, versioning, accessControl);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("name", name)
                .add("owner", owner)
                .add("versioning", versioning)
                .toString();
    }
}
