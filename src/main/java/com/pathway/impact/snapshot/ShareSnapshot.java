package com.pathway.impact.snapshot;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Frozen copy of an analysis, addressed by an opaque share id. The payload is the
 * canonical JSON of the analysis at share time and is never rewritten.
 */
public record ShareSnapshot(String shareId, String analysisId, Instant createdAt, byte[] payload) {

    public ShareSnapshot {
        Objects.requireNonNull(shareId, "shareId is required");
        Objects.requireNonNull(analysisId, "analysisId is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(payload, "payload is required");
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShareSnapshot that)) return false;
        return shareId.equals(that.shareId)
                && analysisId.equals(that.analysisId)
                && createdAt.equals(that.createdAt)
                && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shareId, analysisId, createdAt) * 31 + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "ShareSnapshot{shareId=" + shareId + ", analysisId=" + analysisId
                + ", createdAt=" + createdAt + ", bytes=" + payload.length + '}';
    }
}
