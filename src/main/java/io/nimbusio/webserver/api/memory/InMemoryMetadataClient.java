package io.nimbusio.webserver.api.memory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.nimbusio.webserver.api.backend.MetadataClient;
import io.nimbusio.webserver.api.ids.UnifiedId;
import io.nimbusio.webserver.api.model.Collection;
import io.nimbusio.webserver.api.model.KeyListing;
import io.nimbusio.webserver.api.model.ObjectVersion;
import io.nimbusio.webserver.api.model.SegmentStatus;
import io.nimbusio.webserver.api.model.VersionStatus;
import io.nimbusio.webserver.api.model.exceptions.NoSuchKeyException;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A metadata database held in memory, for single node deployments and tests.
 */
public class InMemoryMetadataClient implements MetadataClient {

    private final AtomicLong nextCollectionId = new AtomicLong(1);
    private final Map<String, Collection> collections = new ConcurrentHashMap<>();

    /**
     * Versions of each collection, ordered by key then version id. Guarded by "this".
     */
    private final Map<Long, NavigableMap<VersionKey, ObjectVersion>> versions = new HashMap<>();
    private final Map<UnifiedId, List<SegmentStatus>> statusRows = new HashMap<>();

    public Collection createCollection(String name, String owner, boolean versioning, @Nullable String accessControl) {
        final Collection collection = new Collection(nextCollectionId.getAndIncrement(), name, owner, versioning,
                accessControl);
        Preconditions.checkState(collections.putIfAbsent(name, collection) == null,
                "collection %s already exists", name);
        return collection;
    }

    @Override
    public Optional<Collection> getCollection(String name) {
        return Optional.ofNullable(collections.get(name));
    }

    @Override
    public synchronized Optional<ObjectVersion> getLiveVersion(long collectionId, String key) {
        return getVersions(collectionId, key).stream()
                .filter(v -> v.getStatus() == VersionStatus.LIVE)
                .max(Comparator.comparing(ObjectVersion::getVersionId));
    }

    @Override
    public synchronized Optional<ObjectVersion> getVersion(long collectionId, UnifiedId versionId) {
        return collectionVersions(collectionId).values().stream()
                .filter(v -> v.getVersionId().equals(versionId))
                .findFirst();
    }

    @Override
    public synchronized List<ObjectVersion> getVersions(long collectionId, String key) {
        return ImmutableList.copyOf(collectionVersions(collectionId)
                .subMap(VersionKey.first(key), true, VersionKey.last(key), true)
                .values());
    }

    @Override
    public synchronized List<SegmentStatus> getSegmentStatus(long collectionId, UnifiedId versionId) {
        return ImmutableList.copyOf(statusRows.getOrDefault(versionId, ImmutableList.of()));
    }

    @Override
    public synchronized void putVersion(ObjectVersion version) {
        collectionVersions(version.getCollectionId())
                .put(new VersionKey(version.getKey(), version.getVersionId()), version);
    }

    @Override
    public synchronized void putSegmentStatus(long collectionId, UnifiedId versionId, List<SegmentStatus> rows) {
        statusRows.put(versionId, ImmutableList.copyOf(rows));
    }

    @Override
    public synchronized void updateStatus(long collectionId, UnifiedId versionId, VersionStatus status) {
        final ObjectVersion version = getVersion(collectionId, versionId)
                .orElseThrow(() -> new NoSuchKeyException("No such version " + versionId));
        putVersion(version.withStatus(status));
    }

    @Override
    public synchronized void removeVersion(long collectionId, UnifiedId versionId) {
        collectionVersions(collectionId).values().removeIf(v -> v.getVersionId().equals(versionId));
        statusRows.remove(versionId);
    }

    @Override
    public synchronized KeyListing listKeys(long collectionId,
                                            String prefix,
                                            @Nullable String marker,
                                            @Nullable String delimiter,
                                            int maxKeys) {
        final List<ObjectVersion> keys = new ArrayList<>();
        final List<String> prefixes = new ArrayList<>();
        int count = 0;
        for (ObjectVersion version : liveVersions(collectionId)) {
            final String key = version.getKey();
            if (!key.startsWith(prefix) || (marker != null && key.compareTo(marker) <= 0)) {
                continue;
            }
            String commonPrefix = null;
            if (delimiter != null) {
                final int index = key.indexOf(delimiter, prefix.length());
                if (index >= 0) {
                    commonPrefix = key.substring(0, index + delimiter.length());
                }
            }
            if (commonPrefix != null) {
                if ((marker != null && commonPrefix.compareTo(marker) <= 0)
                        || (!prefixes.isEmpty() && prefixes.get(prefixes.size() - 1).equals(commonPrefix))) {
                    continue;
                }
            }
            if (count == maxKeys) {
                return new KeyListing(keys, prefixes, true);
            }
            if (commonPrefix != null) {
                prefixes.add(commonPrefix);
            } else {
                keys.add(version);
            }
            count++;
        }
        return new KeyListing(keys, prefixes, false);
    }

    @Override
    public synchronized List<ObjectVersion> listVersions(long collectionId,
                                                         String prefix,
                                                         @Nullable String keyMarker,
                                                         @Nullable UnifiedId versionMarker,
                                                         int limit) {
        final List<ObjectVersion> result = new ArrayList<>();
        for (ObjectVersion version : collectionVersions(collectionId).values()) {
            if (result.size() == limit) {
                break;
            }
            final String key = version.getKey();
            if (!key.startsWith(prefix)
                    || version.getStatus() == VersionStatus.TOMBSTONE
                    || version.getStatus() == VersionStatus.PENDING) {
                continue;
            }
            if (keyMarker != null) {
                final int cmp = key.compareTo(keyMarker);
                if (cmp < 0 || (cmp == 0 && (versionMarker == null
                        || version.getVersionId().compareTo(versionMarker) <= 0))) {
                    continue;
                }
            }
            result.add(version);
        }
        return result;
    }

    /**
     * The live version of every key, in key order.
     */
    private List<ObjectVersion> liveVersions(long collectionId) {
        final Map<String, ObjectVersion> live = new TreeMap<>();
        for (ObjectVersion version : collectionVersions(collectionId).values()) {
            if (version.getStatus() == VersionStatus.LIVE) {
                live.put(version.getKey(), version);
            }
        }
        return new ArrayList<>(live.values());
    }

    private NavigableMap<VersionKey, ObjectVersion> collectionVersions(long collectionId) {
        return versions.computeIfAbsent(collectionId, id -> new TreeMap<>());
    }

    private static final class VersionKey implements Comparable<VersionKey> {
        private final String key;
        private final UnifiedId versionId;

        VersionKey(String key, UnifiedId versionId) {
            this.key = key;
            this.versionId = versionId;
        }

        static VersionKey first(String key) {
            return new VersionKey(key, UnifiedId.of(0));
        }

        static VersionKey last(String key) {
            return new VersionKey(key, UnifiedId.of(Long.MAX_VALUE));
        }

        @Override
        public int compareTo(VersionKey other) {
            final int cmp = key.compareTo(other.key);
            return cmp != 0 ? cmp : versionId.compareTo(other.versionId);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            VersionKey that = (VersionKey) o;
            return key.equals(that.key) && versionId.equals(that.versionId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(key, versionId);
        }
    }
}
