package com.eainde.loganalyzer.nodes;

import com.eainde.loganalyzer.aggregate.GroupAggregator;
import com.eainde.loganalyzer.model.LogGroup;
import com.eainde.loganalyzer.parse.EventParser;
import com.eainde.loganalyzer.parse.ExceptionExtractor;
import com.eainde.loganalyzer.parse.SignatureNormalizer;
import com.eainde.loganalyzer.state.LogAnalysisState;
import com.eainde.loganalyzer.workflow.AnalysisStage;
import com.eainde.loganalyzer.workflow.LogAnalysisException;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Parses and aggregates every input file in parallel, one {@link GroupAggregator} per file, then
 * merges them in input order.
 *
 * <p>Missing files are skipped with a warning. An I/O error on an existing file fails the run at
 * {@link AnalysisStage#READ}, keeping the groups of the files that were read successfully.</p>
 */
@Slf4j
@Component
public class ReadLogsNode implements AsyncNodeAction<LogAnalysisState> {

    private final EventParser parser;
    private final SignatureNormalizer normalizer;
    private final ExceptionExtractor extractor;
    private final int examplesPerGroup;
    private final int maxTokensPerGroup;
    private final Executor executor;

    public ReadLogsNode(EventParser parser,
                        SignatureNormalizer normalizer,
                        ExceptionExtractor extractor,
                        @Value("${loganalyzer.aggregation.examples-per-group:3}") int examplesPerGroup,
                        @Value("${loganalyzer.aggregation.max-tokens-per-group:20}") int maxTokensPerGroup,
                        @Qualifier("analysisExecutor") Executor executor) {
        this.parser = parser;
        this.normalizer = normalizer;
        this.extractor = extractor;
        this.examplesPerGroup = examplesPerGroup;
        this.maxTokensPerGroup = maxTokensPerGroup;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(LogAnalysisState state) {
        List<Path> files = new ArrayList<>();
        for (String input : state.getInputPaths()) {
            Path path = Path.of(input);
            if (Files.isRegularFile(path)) {
                files.add(path);
            } else {
                log.warn("Input {} does not exist or is not a file, skipping", path);
            }
        }

        List<CompletableFuture<GroupAggregator>> perFile = new ArrayList<>();
        for (Path file : files) {
            perFile.add(CompletableFuture.supplyAsync(() -> readFile(file), executor));
        }

        GroupAggregator total = newAggregator();
        Path failedFile = null;
        Throwable failure = null;
        for (int i = 0; i < perFile.size(); i++) {
            try {
                total.merge(perFile.get(i).join());
            } catch (CompletionException e) {
                if (failure == null) {
                    failedFile = files.get(i);
                    failure = e.getCause() instanceof UncheckedIOException
                            ? e.getCause().getCause()
                            : e.getCause();
                }
            }
        }

        List<LogGroup> groups = total.finalizeGroups();
        if (failure != null) {
            log.error("Reading {} failed, {} groups aggregated so far", failedFile, groups.size(), failure);
            return CompletableFuture.completedFuture(LogAnalysisState.failure(
                    new LogAnalysisException(AnalysisStage.READ, failedFile.toString(),
                            "Failed to read " + failedFile, failure, groups)));
        }

        log.info("Aggregated {} events from {} files into {} groups", total.eventCount(), files.size(), groups.size());
        return CompletableFuture.completedFuture(Map.of(
                LogAnalysisState.GROUPS, groups,
                LogAnalysisState.EVENT_COUNT, total.eventCount()));
    }

    private GroupAggregator readFile(Path file) {
        GroupAggregator aggregator = newAggregator();
        int lines = 0;
        // InputStreamReader substitutes malformed bytes instead of failing
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines++;
                parser.parse(line).ifPresent(aggregator::add);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        log.debug("{}: {} lines read, {} skipped", file, lines, lines - aggregator.eventCount());
        return aggregator;
    }

    private GroupAggregator newAggregator() {
        return new GroupAggregator(normalizer, extractor, examplesPerGroup, maxTokensPerGroup);
    }
}
