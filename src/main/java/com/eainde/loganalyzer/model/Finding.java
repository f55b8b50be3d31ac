package com.eainde.loganalyzer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * A reconciled statement about one {@link LogGroup}. Counts and rates always come from the group;
 * only the root cause, severity and recommendation may originate from the model.
 *
 * @param signatureRef       signature of the group this finding describes
 * @param totalEvents        event count of the group
 * @param errorRate          ERROR share of the group, in [0, 1]
 * @param probableRootCause  model text or a deterministic fallback, never blank
 * @param severity           model-supplied severity, or null
 * @param recommendation     model text or fallback, may be null
 * @param levelCounts        per-level histogram of the group
 * @param examples           example raw lines of the group
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record Finding(
        @JsonProperty("signature_ref")       String signatureRef,
        @JsonProperty("total_events")        int totalEvents,
        @JsonProperty("error_rate")          double errorRate,
        @JsonProperty("probable_root_cause") String probableRootCause,
        @JsonProperty("severity")            Severity severity,
        @JsonProperty("recommendation")      String recommendation,
        @JsonProperty("level_counts")        Map<LogLevel, Integer> levelCounts,
        @JsonProperty("examples")            List<String> examples
) implements Serializable {
    public int levelCount(LogLevel level) {
        return levelCounts == null ? 0 : levelCounts.getOrDefault(level, 0);
    }
}
