package com.eainde.loganalyzer.model;

import java.io.Serializable;

/**
 * A finding as returned by the model. Untrusted: every field may be missing, wrong or invented.
 *
 * @param signatureRef      signature the model claims to describe, may be null
 * @param totalEvents       model-reported count, never used for output
 * @param errorRate         model-reported rate, never used for output
 * @param probableRootCause may be null or a placeholder
 * @param severity          raw severity text, may be null
 * @param recommendation    may be null
 */
public record CandidateFinding(
        String signatureRef,
        Integer totalEvents,
        Double errorRate,
        String probableRootCause,
        String severity,
        String recommendation
) implements Serializable {
}
