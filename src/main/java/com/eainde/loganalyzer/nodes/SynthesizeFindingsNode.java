package com.eainde.loganalyzer.nodes;

import com.eainde.loganalyzer.llm.FindingsSynthesizer;
import com.eainde.loganalyzer.llm.PromptBuilder;
import com.eainde.loganalyzer.llm.TransportException;
import com.eainde.loganalyzer.model.CandidateFinding;
import com.eainde.loganalyzer.model.LogGroup;
import com.eainde.loganalyzer.state.LogAnalysisState;
import com.eainde.loganalyzer.workflow.AnalysisStage;
import com.eainde.loganalyzer.workflow.LogAnalysisException;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Asks the model for candidate findings. An unreachable model fails the run; the groups are kept
 * on the failure. With no groups at all the model is not called.
 */
@Slf4j
@Component
public class SynthesizeFindingsNode implements AsyncNodeAction<LogAnalysisState> {

    private final PromptBuilder promptBuilder;
    private final FindingsSynthesizer synthesizer;

    public SynthesizeFindingsNode(PromptBuilder promptBuilder, FindingsSynthesizer synthesizer) {
        this.promptBuilder = promptBuilder;
        this.synthesizer = synthesizer;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(LogAnalysisState state) {
        List<LogGroup> groups = state.getGroups();
        if (groups.isEmpty()) {
            log.info("No events aggregated, skipping model call");
            return CompletableFuture.completedFuture(Map.of(LogAnalysisState.CANDIDATES, List.of()));
        }

        try {
            List<CandidateFinding> candidates = synthesizer.synthesize(promptBuilder.build(groups));
            return CompletableFuture.completedFuture(Map.of(LogAnalysisState.CANDIDATES, List.copyOf(candidates)));
        } catch (TransportException e) {
            log.error("Model {} unreachable after {} attempts", synthesizer.model(), e.getAttempts());
            return CompletableFuture.completedFuture(LogAnalysisState.failure(
                    new LogAnalysisException(AnalysisStage.SYNTHESIZE, "model " + synthesizer.model(),
                            e.getMessage(), e, groups)));
        }
    }
}
