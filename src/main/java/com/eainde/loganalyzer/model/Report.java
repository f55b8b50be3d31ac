package com.eainde.loganalyzer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Terminal artifact of a run. Serialized as-is to the JSON findings file.
 */
public record Report(
        @JsonProperty("generated_at") Instant generatedAt,
        @JsonProperty("source_files") List<String> sourceFiles,
        @JsonProperty("findings")     List<Finding> findings,
        @JsonProperty("summary")      ReportSummary summary
) implements Serializable {
    public Report {
        sourceFiles = List.copyOf(sourceFiles);
        findings = List.copyOf(findings);
    }
}
