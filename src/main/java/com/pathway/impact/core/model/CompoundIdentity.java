package com.pathway.impact.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Canonical identity of a parent compound.
 * Created once by the identity resolver and never mutated; cached by canonical id
 * and indexed by structure key.
 *
 * @param canonicalId       canonical parent compound id (e.g. a ChEMBL parent id)
 * @param displayName       preferred display name
 * @param structureKey      InChIKey-equivalent canonical structure key
 * @param synonyms          known synonyms, in provider order
 * @param clinicalPhase     maximum clinical phase, or null when unknown
 * @param mechanismOfAction free-text mechanism, or null when unknown
 * @param novel             true when minted from a structure with no catalogued compound
 */
public record CompoundIdentity(
        String canonicalId,
        String displayName,
        String structureKey,
        List<String> synonyms,
        Integer clinicalPhase,
        String mechanismOfAction,
        boolean novel
) {
    public CompoundIdentity {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        if (canonicalId.isBlank()) {
            throw new IllegalArgumentException("canonicalId must not be blank");
        }
        displayName = displayName != null ? displayName : canonicalId;
        synonyms = synonyms != null ? List.copyOf(synonyms) : List.of();
    }

    /**
     * Creates an identity for a catalogued compound.
     */
    public static CompoundIdentity of(String canonicalId, String displayName, String structureKey,
                                      List<String> synonyms) {
        return new CompoundIdentity(canonicalId, displayName, structureKey, synonyms, null, null, false);
    }
}
