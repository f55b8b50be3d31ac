package com.eainde.loganalyzer.nodes;

import com.eainde.loganalyzer.model.Report;
import com.eainde.loganalyzer.report.ReportWriteException;
import com.eainde.loganalyzer.report.ReportWriter;
import com.eainde.loganalyzer.state.LogAnalysisState;
import com.eainde.loganalyzer.workflow.AnalysisStage;
import com.eainde.loganalyzer.workflow.LogAnalysisException;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Component
public class WriteReportNode implements AsyncNodeAction<LogAnalysisState> {

    private final ReportWriter reportWriter;

    public WriteReportNode(ReportWriter reportWriter) {
        this.reportWriter = reportWriter;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(LogAnalysisState state) {
        try {
            Report report = reportWriter.write(state.getFindings(), state.getInputPaths());
            return CompletableFuture.completedFuture(Map.of(
                    LogAnalysisState.REPORT, report,
                    LogAnalysisState.JSON_PATH, reportWriter.jsonPath().toString(),
                    LogAnalysisState.MARKDOWN_PATH, reportWriter.markdownPath().toString()));
        } catch (ReportWriteException e) {
            log.error("Report could not be written to {}", e.getTarget(), e);
            return CompletableFuture.completedFuture(LogAnalysisState.failure(
                    new LogAnalysisException(AnalysisStage.WRITE, String.valueOf(e.getTarget()),
                            e.getMessage(), e, state.getGroups())));
        }
    }
}
