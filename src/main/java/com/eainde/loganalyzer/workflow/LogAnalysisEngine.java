package com.eainde.loganalyzer.workflow;

import com.eainde.loganalyzer.model.Report;
import com.eainde.loganalyzer.state.LogAnalysisState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Entry point for analysis runs.
 * <p>
 * Each call gets its own run id, which is put on the MDC under {@value #RUN_ID} for the duration
 * of the run and used as the graph thread id. A failure recorded by any stage is rethrown as the
 * {@link LogAnalysisException} the stage created.
 * </p>
 */
@Log4j2
@Service
public class LogAnalysisEngine {

    public static final String RUN_ID = "runId";

    private final CompiledGraph<LogAnalysisState> graph;

    public LogAnalysisEngine(@Qualifier("logAnalyzerWorkflow") CompiledGraph<LogAnalysisState> graph) {
        this.graph = graph;
    }

    /**
     * Runs the whole pipeline over the given files.
     *
     * @param inputs log files, read in this order; missing ones are skipped
     * @return the written report and where it was written
     * @throws LogAnalysisException when reading, the model call or writing failed
     */
    public AnalysisResult analyze(List<Path> inputs) {
        String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID, runId);
        try {
            log.info("Starting log analysis {} over {} files", runId, inputs.size());

            Map<String, Object> initial = Map.of(LogAnalysisState.INPUT_PATHS,
                    inputs.stream().map(Path::toString).collect(Collectors.toList()));
            RunnableConfig config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            LogAnalysisState state = graph.invoke(initial, config)
                    .orElseThrow(() -> new IllegalStateException("Workflow " + runId + " produced no state"));

            if (state.getError().isPresent()) {
                LogAnalysisException error = state.getError().get();
                log.error("Log analysis {} failed at {} ({})", runId, error.getStage(), error.getSource());
                throw error;
            }

            Report report = state.getReport()
                    .orElseThrow(() -> new IllegalStateException("Workflow " + runId + " finished without a report"));
            AnalysisResult result = new AnalysisResult(runId, report,
                    Path.of(state.getJsonPath().orElseThrow()),
                    Path.of(state.getMarkdownPath().orElseThrow()),
                    state.getNewSignatures());
            log.info("Log analysis {} finished: {}", runId, report.summary().shortSummary());
            return result;
        } finally {
            MDC.remove(RUN_ID);
        }
    }
}
