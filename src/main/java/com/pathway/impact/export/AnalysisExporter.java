package com.pathway.impact.export;

import com.pathway.impact.api.AnalysisResult;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Writes an analysis in one export format.
 */
public interface AnalysisExporter {

    /**
     * Writes the export and returns the number of pathway rows it contains.
     */
    int export(AnalysisResult result, Writer writer) throws IOException;

    /**
     * Returns the format produced by this exporter ("csv", "json").
     */
    String getFormat();

    default String exportToString(AnalysisResult result) {
        StringWriter writer = new StringWriter();
        try {
            export(result, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }
}
