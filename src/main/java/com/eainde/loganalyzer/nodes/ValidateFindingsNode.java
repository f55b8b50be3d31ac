package com.eainde.loganalyzer.nodes;

import com.eainde.loganalyzer.model.Finding;
import com.eainde.loganalyzer.state.LogAnalysisState;
import com.eainde.loganalyzer.validate.ResultValidator;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class ValidateFindingsNode implements AsyncNodeAction<LogAnalysisState> {

    private final ResultValidator validator;

    public ValidateFindingsNode(ResultValidator validator) {
        this.validator = validator;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(LogAnalysisState state) {
        List<Finding> findings = validator.validate(state.getGroups(), state.getCandidates());
        return CompletableFuture.completedFuture(Map.of(LogAnalysisState.FINDINGS, List.copyOf(findings)));
    }
}
