package com.eainde.loganalyzer.workflow;

import com.eainde.loganalyzer.model.LogGroup;

import java.util.List;

/**
 * Run-level failure. Carries the failing stage, the file or endpoint involved and whatever groups
 * were aggregated before the failure, so the caller can retry or inspect.
 */
public class LogAnalysisException extends RuntimeException {

    private final AnalysisStage stage;
    private final String source;
    private final List<LogGroup> partialGroups;

    public LogAnalysisException(AnalysisStage stage, String source, String message,
                                Throwable cause, List<LogGroup> partialGroups) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
        this.source = source;
        this.partialGroups = partialGroups == null ? List.of() : List.copyOf(partialGroups);
    }

    public AnalysisStage getStage() {
        return stage;
    }

    public String getSource() {
        return source;
    }

    public List<LogGroup> getPartialGroups() {
        return partialGroups;
    }
}
