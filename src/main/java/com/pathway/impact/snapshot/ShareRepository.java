package com.pathway.impact.snapshot;

import java.util.Optional;

/**
 * Write-once storage for share snapshots.
 */
public interface ShareRepository {

    /**
     * Stores a new share.
     *
     * @throws IllegalStateException when the share id is already taken
     */
    ShareSnapshot insert(ShareSnapshot snapshot);

    Optional<ShareSnapshot> findById(String shareId);
}
