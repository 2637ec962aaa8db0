package com.pathway.impact.export;

import com.pathway.impact.api.AnalysisResult;
import com.pathway.impact.core.model.PathwayScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.regex.Pattern;

/**
 * CSV export of the displayed pathways.
 *
 * <p>Output format:</p>
 * <pre>
 * # pathway_impact_export_version: 1
 * # analysis_id: 5b0c...
 * # created_at: 2024-01-01T00:00:00Z
 * # params: {"includeLowConfidence":false,...}
 * # version_snapshot: {"chembl":"34","reactome":"88"}
 * # analysis_flags: {"highVariability":"unknown",...}
 * # attribution: Data sources: ...
 * pathway_id,pathway_name,score,targets_hit,coverage_ratio,depth,pathway_size,median_potency,reactome_url
 * R-HSA-177929,"Signaling by EGFR",0.091,1,0.01,4,100,9.1,https://reactome.org/content/detail/R-HSA-177929
 * </pre>
 */
public class CsvAnalysisExporter implements AnalysisExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvAnalysisExporter.class);

    public static final String HEADER =
            "pathway_id,pathway_name,score,targets_hit,coverage_ratio,depth,pathway_size,median_potency,reactome_url";
    public static final String REACTOME_URL = "https://reactome.org/content/detail/";

    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n|\\r|\\n");

    private final AnalysisJson json;

    public CsvAnalysisExporter(AnalysisJson json) {
        this.json = json;
    }

    @Override
    public int export(AnalysisResult result, Writer writer) throws IOException {
        ExportMetadata metadata = ExportMetadata.of(result);
        writer.write("# pathway_impact_export_version: " + metadata.exportVersion() + "\n");
        writer.write("# analysis_id: " + singleLine(metadata.analysisId()) + "\n");
        writer.write("# created_at: " + metadata.createdAt() + "\n");
        writer.write("# params: " + json.toJson(metadata.params()) + "\n");
        writer.write("# version_snapshot: " + json.toJson(metadata.versionSnapshot().sources()) + "\n");
        writer.write("# analysis_flags: " + json.toJson(metadata.analysisFlags()) + "\n");
        writer.write("# attribution: " + singleLine(metadata.attribution()) + "\n");
        writer.write(HEADER + "\n");

        int rows = 0;
        for (PathwayScore pathway : result.pathways()) {
            writer.write(String.join(",",
                    csvEscape(pathway.pathwayId()),
                    csvEscape(pathway.pathwayName()),
                    Double.toString(pathway.score()),
                    Integer.toString(pathway.targetsHit()),
                    Double.toString(pathway.coverageRatio()),
                    Integer.toString(pathway.depth()),
                    Integer.toString(pathway.pathwaySize()),
                    Double.toString(pathway.medianPotency()),
                    csvEscape(REACTOME_URL + pathway.pathwayId())));
            writer.write("\n");
            rows++;
        }
        writer.flush();
        log.debug("export.csv analysisId={} rows={}", result.analysisId(), rows);
        return rows;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    // metadata lines are "# key: value", one per line
    static String singleLine(String value) {
        return value == null ? "" : LINE_BREAKS.matcher(value).replaceAll(" ");
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
