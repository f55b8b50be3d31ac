package com.eainde.loganalyzer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Events attributed to one root-cause text across all findings.
 */
public record RootCauseSummary(
        @JsonProperty("probable_root_cause") String probableRootCause,
        @JsonProperty("total_events")        int totalEvents,
        @JsonProperty("signature_refs")      List<String> signatureRefs
) implements Serializable {
}
