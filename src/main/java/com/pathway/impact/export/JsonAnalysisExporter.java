package com.pathway.impact.export;

import com.pathway.impact.api.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;

/**
 * JSON export: {@code {"analysis": {...}, "metadata": {...}}} with sorted keys.
 */
public class JsonAnalysisExporter implements AnalysisExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonAnalysisExporter.class);

    private final AnalysisJson json;

    public JsonAnalysisExporter(AnalysisJson json) {
        this.json = json;
    }

    @Override
    public int export(AnalysisResult result, Writer writer) throws IOException {
        writer.write(json.toJson(new JsonExport(ExportMetadata.of(result), result)));
        writer.flush();
        log.debug("export.json analysisId={} pathways={}", result.analysisId(), result.pathways().size());
        return result.pathways().size();
    }

    /**
     * Parses a document written by {@link #export}.
     */
    public JsonExport read(String document) throws IOException {
        return json.fromJson(document, JsonExport.class);
    }

    @Override
    public String getFormat() {
        return "json";
    }

    public record JsonExport(ExportMetadata metadata, AnalysisResult analysis) {
    }
}
