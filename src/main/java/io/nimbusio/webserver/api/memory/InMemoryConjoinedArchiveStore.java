package io.nimbusio.webserver.api.memory;

import com.google.common.collect.ImmutableList;
import io.nimbusio.webserver.api.backend.ConjoinedArchiveStore;
import io.nimbusio.webserver.api.ids.UnifiedId;
import io.nimbusio.webserver.api.model.ConjoinedArchive;
import io.nimbusio.webserver.api.model.ConjoinedPart;

import javax.annotation.Nullable;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

public class InMemoryConjoinedArchiveStore implements ConjoinedArchiveStore {

    private final Map<UnifiedId, ConjoinedArchive> archives = new ConcurrentHashMap<>();
    private final Map<UnifiedId, NavigableMap<Integer, ConjoinedPart>> parts = new ConcurrentHashMap<>();

    @Override
    public void insert(ConjoinedArchive archive) {
        if (archives.putIfAbsent(archive.getUnifiedId(), archive) != null) {
            throw new IllegalStateException("Duplicate conjoined archive id " + archive.getUnifiedId());
        }
    }

    @Override
    public Optional<ConjoinedArchive> get(UnifiedId unifiedId) {
        return Optional.ofNullable(archives.get(unifiedId));
    }

    @Override
    public boolean compareAndSet(ConjoinedArchive expected, ConjoinedArchive updated) {
        return archives.replace(expected.getUnifiedId(), expected, updated);
    }

    @Override
    public List<ConjoinedArchive> list(long collectionId,
                                       @Nullable String keyMarker,
                                       @Nullable UnifiedId idMarker,
                                       int limit) {
        return archives.values().stream()
                .filter(a -> a.getCollectionId() == collectionId)
                .filter(a -> keyMarker == null || a.getKey().compareTo(keyMarker) > 0)
                .filter(a -> idMarker == null || a.getUnifiedId().compareTo(idMarker) > 0)
                .sorted(Comparator.comparing(ConjoinedArchive::getUnifiedId))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public AddPartResult addPart(UnifiedId unifiedId, ConjoinedPart part) {
        final AtomicReference<AddPartResult> result = new AtomicReference<>(AddPartResult.NOT_ACTIVE);
        // Holding the archive's entry lock orders the insert against compareAndSet on the same archive.
        archives.computeIfPresent(unifiedId, (id, archive) -> {
            if (!archive.getState().isTerminal()) {
                final boolean added = parts.computeIfAbsent(id, partsId -> new ConcurrentSkipListMap<>())
                        .putIfAbsent(part.getPartNumber(), part) == null;
                result.set(added ? AddPartResult.ADDED : AddPartResult.DUPLICATE_PART);
            }
            return archive;
        });
        return result.get();
    }

    @Override
    public List<ConjoinedPart> getParts(UnifiedId unifiedId) {
        final NavigableMap<Integer, ConjoinedPart> archiveParts = parts.get(unifiedId);
        return archiveParts == null ? ImmutableList.of() : ImmutableList.copyOf(archiveParts.values());
    }

    @Override
    public void removeParts(UnifiedId unifiedId) {
        parts.remove(unifiedId);
    }
}
