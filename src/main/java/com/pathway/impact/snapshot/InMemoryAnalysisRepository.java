package com.pathway.impact.snapshot;

import com.pathway.impact.api.AnalysisResult;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory implementation of {@link AnalysisRepository}.
 */
public class InMemoryAnalysisRepository implements AnalysisRepository {

    private final Map<String, AnalysisResult> results = new ConcurrentHashMap<>();

    @Override
    public AnalysisResult save(AnalysisResult result) {
        results.put(result.analysisId(), result);
        return result;
    }

    @Override
    public Optional<AnalysisResult> findById(String analysisId) {
        return Optional.ofNullable(results.get(analysisId));
    }

    @Override
    public int count() {
        return results.size();
    }
}
