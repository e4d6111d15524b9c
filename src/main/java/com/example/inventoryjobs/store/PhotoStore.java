package com.example.inventoryjobs.store;

import com.example.inventoryjobs.domain.enums.ThumbnailStatus;
import com.example.inventoryjobs.domain.model.ThumbnailPaths;

import java.util.Optional;
import java.util.UUID;

/**
 * Thumbnail state of item photos.
 * <p>
 * Every transition is guarded on its allowed predecessor states, so a status never moves
 * backwards: each method returns false when the photo is gone or not in a state the
 * transition applies to.
 */
public interface PhotoStore {

    Optional<ThumbnailStatus> findThumbnailStatus(UUID photoId);

    /**
     * pending | processing → processing
     */
    boolean markProcessing(UUID photoId);

    /**
     * processing → ready, storing the generated paths
     */
    boolean markReady(UUID photoId, ThumbnailPaths paths);

    /**
     * pending | processing → failed
     */
    boolean markFailed(UUID photoId, String error);

    /**
     * Record the diagnostic of a failed attempt while the photo stays processing
     */
    boolean recordAttemptError(UUID photoId, String error);

    /**
     * failed → pending, for an operator-requested regeneration
     */
    boolean resetToPending(UUID photoId);
}
