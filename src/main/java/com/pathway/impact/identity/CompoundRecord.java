package com.pathway.impact.identity;

import com.pathway.impact.core.model.CompoundIdentity;

import java.util.List;
import java.util.Objects;

/**
 * A compound as returned by the identity search provider.
 */
public record CompoundRecord(
        String canonicalId,
        String displayName,
        String structureKey,
        List<String> synonyms,
        Integer clinicalPhase,
        String mechanismOfAction
) {
    public CompoundRecord {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        displayName = displayName != null ? displayName : canonicalId;
        synonyms = synonyms != null ? List.copyOf(synonyms) : List.of();
    }

    public static CompoundRecord of(String canonicalId, String displayName, String structureKey, String... synonyms) {
        return new CompoundRecord(canonicalId, displayName, structureKey, List.of(synonyms), null, null);
    }

    public CompoundIdentity toIdentity() {
        return new CompoundIdentity(canonicalId, displayName, structureKey, synonyms,
                clinicalPhase, mechanismOfAction, false);
    }
}
