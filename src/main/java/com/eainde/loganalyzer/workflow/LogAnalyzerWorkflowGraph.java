package com.eainde.loganalyzer.workflow;

import com.eainde.loganalyzer.edges.FailureRoutingEdge;
import com.eainde.loganalyzer.nodes.MarkNewSignaturesNode;
import com.eainde.loganalyzer.nodes.ReadLogsNode;
import com.eainde.loganalyzer.nodes.SynthesizeFindingsNode;
import com.eainde.loganalyzer.nodes.ValidateFindingsNode;
import com.eainde.loganalyzer.nodes.WriteReportNode;
import com.eainde.loganalyzer.state.LogAnalysisState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.eainde.loganalyzer.edges.FailureRoutingEdge.CONTINUE;
import static com.eainde.loganalyzer.edges.FailureRoutingEdge.FAILED;
import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * read_logs -> synthesize_findings -> validate_findings -> write_report -> mark_new_signatures.
 * Stages that can fail the run are followed by a {@link FailureRoutingEdge}.
 */
@Component
public class LogAnalyzerWorkflowGraph {

    public static final String READ_LOGS = "read_logs";
    public static final String SYNTHESIZE_FINDINGS = "synthesize_findings";
    public static final String VALIDATE_FINDINGS = "validate_findings";
    public static final String WRITE_REPORT = "write_report";
    public static final String MARK_NEW_SIGNATURES = "mark_new_signatures";

    private final ReadLogsNode readLogsNode;
    private final SynthesizeFindingsNode synthesizeNode;
    private final ValidateFindingsNode validateNode;
    private final WriteReportNode writeReportNode;
    private final MarkNewSignaturesNode markNewSignaturesNode;
    private final FailureRoutingEdge failureRoutingEdge;

    public LogAnalyzerWorkflowGraph(ReadLogsNode readLogsNode,
                                    SynthesizeFindingsNode synthesizeNode,
                                    ValidateFindingsNode validateNode,
                                    WriteReportNode writeReportNode,
                                    MarkNewSignaturesNode markNewSignaturesNode,
                                    FailureRoutingEdge failureRoutingEdge) {
        this.readLogsNode = readLogsNode;
        this.synthesizeNode = synthesizeNode;
        this.validateNode = validateNode;
        this.writeReportNode = writeReportNode;
        this.markNewSignaturesNode = markNewSignaturesNode;
        this.failureRoutingEdge = failureRoutingEdge;
    }

    @Bean("logAnalyzerWorkflow")
    public CompiledGraph<LogAnalysisState> build() throws GraphStateException {

        StateGraph<LogAnalysisState> workflow = new StateGraph<>(LogAnalysisState::new);

        workflow.addNode(READ_LOGS, readLogsNode);
        workflow.addNode(SYNTHESIZE_FINDINGS, synthesizeNode);
        workflow.addNode(VALIDATE_FINDINGS, validateNode);
        workflow.addNode(WRITE_REPORT, writeReportNode);
        workflow.addNode(MARK_NEW_SIGNATURES, markNewSignaturesNode);

        workflow.addEdge(START, READ_LOGS);
        workflow.addConditionalEdges(READ_LOGS, failureRoutingEdge,
                Map.of(CONTINUE, SYNTHESIZE_FINDINGS, FAILED, END));
        workflow.addConditionalEdges(SYNTHESIZE_FINDINGS, failureRoutingEdge,
                Map.of(CONTINUE, VALIDATE_FINDINGS, FAILED, END));
        workflow.addEdge(VALIDATE_FINDINGS, WRITE_REPORT);
        workflow.addConditionalEdges(WRITE_REPORT, failureRoutingEdge,
                Map.of(CONTINUE, MARK_NEW_SIGNATURES, FAILED, END));
        workflow.addEdge(MARK_NEW_SIGNATURES, END);

        return workflow.compile();
    }
}
