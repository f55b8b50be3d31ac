package com.eainde.loganalyzer.workflow;

/** Stage of a run that can fail the whole run. */
public enum AnalysisStage {
    READ,
    SYNTHESIZE,
    WRITE
}
