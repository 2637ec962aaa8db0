package com.pathway.impact.snapshot;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory implementation of {@link ShareRepository}.
 */
public class InMemoryShareRepository implements ShareRepository {

    private final Map<String, ShareSnapshot> shares = new ConcurrentHashMap<>();

    @Override
    public ShareSnapshot insert(ShareSnapshot snapshot) {
        ShareSnapshot existing = shares.putIfAbsent(snapshot.shareId(), snapshot);
        if (existing != null) {
            throw new IllegalStateException("Share " + snapshot.shareId() + " already exists");
        }
        return snapshot;
    }

    @Override
    public Optional<ShareSnapshot> findById(String shareId) {
        return Optional.ofNullable(shares.get(shareId));
    }
}
