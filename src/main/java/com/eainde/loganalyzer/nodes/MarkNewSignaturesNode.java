package com.eainde.loganalyzer.nodes;

import com.eainde.loganalyzer.dedup.DedupStore;
import com.eainde.loganalyzer.model.Finding;
import com.eainde.loganalyzer.model.LogLevel;
import com.eainde.loganalyzer.state.LogAnalysisState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Marks every error-bearing signature in the {@link DedupStore} for today (UTC) and publishes the
 * ones that were not marked yet. Runs after the report is on disk, so a store failure only
 * shortens the list.
 */
@Slf4j
@Component
public class MarkNewSignaturesNode implements AsyncNodeAction<LogAnalysisState> {

    private final DedupStore dedupStore;
    private final Clock clock;
    private final boolean enabled;

    public MarkNewSignaturesNode(DedupStore dedupStore,
                                 Clock clock,
                                 @Value("${loganalyzer.dedup.enabled:true}") boolean enabled) {
        this.dedupStore = dedupStore;
        this.clock = clock;
        this.enabled = enabled;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(LogAnalysisState state) {
        List<String> newSignatures = new ArrayList<>();
        if (!enabled) {
            return CompletableFuture.completedFuture(Map.of(LogAnalysisState.NEW_SIGNATURES, newSignatures));
        }

        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        try {
            for (Finding finding : state.getFindings()) {
                if (finding.levelCount(LogLevel.ERROR) == 0) {
                    continue;
                }
                if (!dedupStore.checkAndSet(DedupStore.dailyKey(today, finding.signatureRef()))) {
                    newSignatures.add(finding.signatureRef());
                }
            }
        } catch (UncheckedIOException e) {
            log.warn("Dedup store unavailable, {} new signatures recorded before the failure",
                    newSignatures.size(), e);
        }

        log.info("{} error signatures not seen before today", newSignatures.size());
        return CompletableFuture.completedFuture(Map.of(LogAnalysisState.NEW_SIGNATURES, newSignatures));
    }
}
