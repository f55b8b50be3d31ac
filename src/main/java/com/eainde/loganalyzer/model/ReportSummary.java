package com.eainde.loganalyzer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Totals across every finding of a report.
 *
 * @param totalEvents      sum of {@code total_events} over all findings
 * @param overallErrorRate ERROR events over all events, 0 when there are no events
 * @param errorEvents      ERROR events over all findings
 * @param warnEvents       WARN events over all findings
 * @param infoEvents       INFO events over all findings
 * @param topRootCauses    root causes ranked by attributed event count
 * @param topSignatures    up to three signatures, error-bearing first
 * @param shortSummary     one-sentence deterministic narrative
 */
public record ReportSummary(
        @JsonProperty("total_events")       int totalEvents,
        @JsonProperty("overall_error_rate") double overallErrorRate,
        @JsonProperty("error_events")       int errorEvents,
        @JsonProperty("warn_events")        int warnEvents,
        @JsonProperty("info_events")        int infoEvents,
        @JsonProperty("top_root_causes")    List<RootCauseSummary> topRootCauses,
        @JsonProperty("top_signatures")     List<String> topSignatures,
        @JsonProperty("short_summary")      String shortSummary
) implements Serializable {
}
