package com.eainde.loganalyzer.edges;

import com.eainde.loganalyzer.state.LogAnalysisState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Ends the run as soon as a node has recorded a failure.
 */
@Component
public class FailureRoutingEdge implements AsyncEdgeAction<LogAnalysisState> {

    public static final String FAILED = "failed";
    public static final String CONTINUE = "continue";

    @Override
    public CompletableFuture<String> apply(LogAnalysisState state) {
        return CompletableFuture.completedFuture(state.hasFailed() ? FAILED : CONTINUE);
    }
}
