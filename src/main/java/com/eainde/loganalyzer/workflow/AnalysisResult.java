package com.eainde.loganalyzer.workflow;

import com.eainde.loganalyzer.model.Report;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a successful run.
 *
 * @param runId         id put on the MDC for the run
 * @param report        the written report
 * @param jsonPath      JSON findings artifact
 * @param markdownPath  Markdown summary artifact
 * @param newSignatures error-bearing signatures not yet seen today, empty when dedup is off
 */
public record AnalysisResult(
        String runId,
        Report report,
        Path jsonPath,
        Path markdownPath,
        List<String> newSignatures
) {
    public AnalysisResult {
        newSignatures = List.copyOf(newSignatures);
    }
}
