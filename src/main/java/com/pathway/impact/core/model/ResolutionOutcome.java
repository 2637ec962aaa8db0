package com.pathway.impact.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of a compound resolution. Exactly one of the following holds:
 * <ul>
 *   <li>{@code RESOLVED}: {@code identity} is set, candidates lists every match considered</li>
 *   <li>{@code AMBIGUOUS}: {@code identity} is null, candidates are ranked for the caller</li>
 *   <li>{@code NOT_FOUND}: no identity and no candidates</li>
 * </ul>
 *
 * @param fromCache true when the upstream search was unavailable and a cached outcome was served
 */
public record ResolutionOutcome(
        ResolutionStatus status,
        String query,
        String normalizedQuery,
        CompoundIdentity identity,
        List<ResolutionCandidate> candidates,
        boolean fromCache
) {
    public ResolutionOutcome {
        Objects.requireNonNull(status, "status is required");
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        if (status == ResolutionStatus.RESOLVED && identity == null) {
            throw new IllegalArgumentException("A resolved outcome requires an identity");
        }
        if (status != ResolutionStatus.RESOLVED && identity != null) {
            throw new IllegalArgumentException("Only a resolved outcome may carry an identity");
        }
    }

    public static ResolutionOutcome resolved(String query, String normalizedQuery, CompoundIdentity identity,
                                             List<ResolutionCandidate> candidates) {
        return new ResolutionOutcome(ResolutionStatus.RESOLVED, query, normalizedQuery, identity, candidates, false);
    }

    public static ResolutionOutcome ambiguous(String query, String normalizedQuery,
                                              List<ResolutionCandidate> candidates) {
        return new ResolutionOutcome(ResolutionStatus.AMBIGUOUS, query, normalizedQuery, null, candidates, false);
    }

    public static ResolutionOutcome notFound(String query, String normalizedQuery) {
        return new ResolutionOutcome(ResolutionStatus.NOT_FOUND, query, normalizedQuery, null, List.of(), false);
    }

    /**
     * Returns a copy of this outcome marked as served from cache.
     */
    public ResolutionOutcome servedFromCache() {
        return new ResolutionOutcome(status, query, normalizedQuery, identity, candidates, true);
    }

    public boolean resolved() {
        return status == ResolutionStatus.RESOLVED;
    }
}
