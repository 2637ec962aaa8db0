package com.pathway.impact.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A compound that matched a query, offered to the caller for disambiguation.
 */
public record ResolutionCandidate(
        String canonicalId,
        String displayName,
        String structureKey,
        MatchKind matchKind,
        List<String> matchReasons
) {
    /**
     * Ranking: match kind first, then ascending canonical id.
     */
    public static final Comparator<ResolutionCandidate> RANKING =
            Comparator.comparing(ResolutionCandidate::matchKind)
                    .thenComparing(ResolutionCandidate::canonicalId);

    public ResolutionCandidate {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        Objects.requireNonNull(matchKind, "matchKind is required");
        matchReasons = matchReasons != null ? List.copyOf(matchReasons) : List.of();
    }
}
