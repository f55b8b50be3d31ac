package com.eainde.loganalyzer.state;

import com.eainde.loganalyzer.model.CandidateFinding;
import com.eainde.loganalyzer.model.Finding;
import com.eainde.loganalyzer.model.LogGroup;
import com.eainde.loganalyzer.model.Report;
import com.eainde.loganalyzer.workflow.LogAnalysisException;
import org.bsc.langgraph4j.state.AgentState;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph state of one analysis run. Every node returns a partial map keyed by the constants below;
 * values are never null.
 */
public class LogAnalysisState extends AgentState {

    public static final String INPUT_PATHS = "inputPaths";
    public static final String GROUPS = "groups";
    public static final String EVENT_COUNT = "eventCount";
    public static final String CANDIDATES = "candidates";
    public static final String FINDINGS = "findings";
    public static final String REPORT = "report";
    public static final String JSON_PATH = "jsonPath";
    public static final String MARKDOWN_PATH = "markdownPath";
    public static final String NEW_SIGNATURES = "newSignatures";
    public static final String ERROR = "error";

    public LogAnalysisState(Map<String, Object> initData) {
        super(initData);
    }

    @SuppressWarnings("unchecked")
    public List<String> getInputPaths() {
        return (List<String>) this.data().getOrDefault(INPUT_PATHS, List.of());
    }

    @SuppressWarnings("unchecked")
    public List<LogGroup> getGroups() {
        return (List<LogGroup>) this.data().getOrDefault(GROUPS, List.of());
    }

    public int getEventCount() {
        return this.data().containsKey(EVENT_COUNT) ? (int) this.data().get(EVENT_COUNT) : 0;
    }

    @SuppressWarnings("unchecked")
    public List<CandidateFinding> getCandidates() {
        return (List<CandidateFinding>) this.data().getOrDefault(CANDIDATES, List.of());
    }

    @SuppressWarnings("unchecked")
    public List<Finding> getFindings() {
        return (List<Finding>) this.data().getOrDefault(FINDINGS, List.of());
    }

    public Optional<Report> getReport() {
        return this.value(REPORT);
    }

    public Optional<String> getJsonPath() {
        return this.value(JSON_PATH);
    }

    public Optional<String> getMarkdownPath() {
        return this.value(MARKDOWN_PATH);
    }

    @SuppressWarnings("unchecked")
    public List<String> getNewSignatures() {
        return (List<String>) this.data().getOrDefault(NEW_SIGNATURES, List.of());
    }

    public Optional<LogAnalysisException> getError() {
        return this.value(ERROR);
    }

    public boolean hasFailed() {
        return this.data().containsKey(ERROR);
    }

    public static Map<String, Object> failure(LogAnalysisException error) {
        return Map.of(ERROR, error);
    }
}
