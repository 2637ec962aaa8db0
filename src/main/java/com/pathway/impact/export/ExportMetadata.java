package com.pathway.impact.export;

import com.pathway.impact.api.AnalysisParams;
import com.pathway.impact.api.AnalysisResult;
import com.pathway.impact.core.model.AnalysisFlags;
import com.pathway.impact.snapshot.VersionSnapshot;

import java.time.Instant;

/**
 * Header shared by every export format, taken verbatim from the analysis so that CSV,
 * JSON and the interactive view agree.
 */
public record ExportMetadata(
        int exportVersion,
        String analysisId,
        Instant createdAt,
        AnalysisParams params,
        String attribution,
        VersionSnapshot versionSnapshot,
        AnalysisFlags analysisFlags
) {
    public static final int EXPORT_VERSION = 1;

    public static ExportMetadata of(AnalysisResult result) {
        return new ExportMetadata(EXPORT_VERSION, result.analysisId(), result.createdAt(), result.params(),
                result.attribution(), result.versionSnapshot(), result.analysisFlags());
    }
}
