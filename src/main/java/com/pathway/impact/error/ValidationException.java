package com.pathway.impact.error;

import com.pathway.impact.core.model.ResolutionCandidate;

import java.util.List;

/**
 * Bad or ambiguous caller input. Recoverable: the message is actionable and,
 * for ambiguous compound queries, the ranked candidates are attached so the
 * caller can retry with an explicit resolution choice.
 */
public class ValidationException extends PathwayImpactException {

    private final List<ResolutionCandidate> candidates;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<ResolutionCandidate> candidates) {
        super(message);
        this.candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
        this.candidates = List.of();
    }

    public List<ResolutionCandidate> getCandidates() {
        return candidates;
    }

    public boolean hasCandidates() {
        return !candidates.isEmpty();
    }
}
