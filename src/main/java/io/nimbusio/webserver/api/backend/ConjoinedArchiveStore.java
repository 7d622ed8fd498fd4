package io.nimbusio.webserver.api.backend;

import io.nimbusio.webserver.api.ids.UnifiedId;
import io.nimbusio.webserver.api.model.ConjoinedArchive;
import io.nimbusio.webserver.api.model.ConjoinedPart;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;

/**
 * Storage for conjoined archives and their parts.
 */
public interface ConjoinedArchiveStore {

    enum AddPartResult {
        ADDED,
        DUPLICATE_PART,
        /**
         * The archive is missing or was completed or aborted.
         */
        NOT_ACTIVE
    }

    void insert(ConjoinedArchive archive);

    Optional<ConjoinedArchive> get(UnifiedId unifiedId);

    /**
     * Atomically replace {@code expected} with {@code updated}.
     *
     * @return false if the stored archive is no longer equal to {@code expected}
     */
    boolean compareAndSet(ConjoinedArchive expected, ConjoinedArchive updated);

    /**
     * The archives of a collection ordered by id, with key strictly after {@code keyMarker} and id strictly after
     * {@code idMarker} when those are given.
     */
    List<ConjoinedArchive> list(long collectionId,
                                @Nullable String keyMarker,
                                @Nullable UnifiedId idMarker,
                                int limit);

    /**
     * Add a part to an archive if, and only if, the archive is still active. The check and the insert are atomic with
     * respect to {@link #compareAndSet}: once a completing or aborting swap has succeeded no part can be added.
     */
    AddPartResult addPart(UnifiedId unifiedId, ConjoinedPart part);

    /**
     * The parts of an archive ordered by part number.
     */
    List<ConjoinedPart> getParts(UnifiedId unifiedId);

    void removeParts(UnifiedId unifiedId);
}
