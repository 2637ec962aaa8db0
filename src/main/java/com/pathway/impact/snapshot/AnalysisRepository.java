package com.pathway.impact.snapshot;

import com.pathway.impact.api.AnalysisResult;

import java.util.Optional;

/**
 * Storage for completed analyses. Implementations back onto the transactional store;
 * {@link InMemoryAnalysisRepository} is the default.
 */
public interface AnalysisRepository {

    AnalysisResult save(AnalysisResult result);

    Optional<AnalysisResult> findById(String analysisId);

    int count();
}
