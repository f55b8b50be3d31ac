package com.eainde.loganalyzer.aggregate;

import com.eainde.loganalyzer.model.LogEvent;
import com.eainde.loganalyzer.model.LogGroup;
import com.eainde.loganalyzer.model.LogLevel;
import com.eainde.loganalyzer.parse.ExceptionExtractor;
import com.eainde.loganalyzer.parse.SignatureNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds one {@link LogGroup} per distinct signature from a stream of events.
 *
 * <p>Not thread-safe. Parallel aggregation uses one instance per input file and combines them
 * with {@link #merge(GroupAggregator)}, which sums counts and histograms, unions token counts
 * and appends examples up to the cap. Counts combine commutatively; token counts do too as long
 * as a group stays below {@code maxTokensPerGroup} distinct tokens. Past that cap new tokens are
 * ignored and only the tracked ones keep counting, so memory per group stays bounded.</p>
 *
 * <pre>
 * GroupAggregator total = new GroupAggregator(normalizer, extractor, 3);
 * for (GroupAggregator perFile : perFileAggregators) {
 *     total.merge(perFile);
 * }
 * List&lt;LogGroup&gt; groups = total.finalizeGroups();
 * </pre>
 */
public class GroupAggregator {

    /** Descending count, then signature. */
    public static final Comparator<LogGroup> GROUP_ORDER =
            Comparator.comparingInt(LogGroup::count).reversed()
                    .thenComparing(LogGroup::signature);

    /** Distinct exception tokens tracked per group when no cap is given. */
    public static final int DEFAULT_MAX_TOKENS_PER_GROUP = 20;

    private final SignatureNormalizer normalizer;
    private final ExceptionExtractor extractor;
    private final int examplesPerGroup;
    private final int maxTokensPerGroup;
    private final Map<String, Accumulator> groups = new HashMap<>();
    private int eventCount;

    public GroupAggregator(SignatureNormalizer normalizer, ExceptionExtractor extractor, int examplesPerGroup) {
        this(normalizer, extractor, examplesPerGroup, DEFAULT_MAX_TOKENS_PER_GROUP);
    }

    public GroupAggregator(SignatureNormalizer normalizer, ExceptionExtractor extractor,
                           int examplesPerGroup, int maxTokensPerGroup) {
        if (examplesPerGroup < 0) {
            throw new IllegalArgumentException("examplesPerGroup must be >= 0");
        }
        if (maxTokensPerGroup < 0) {
            throw new IllegalArgumentException("maxTokensPerGroup must be >= 0");
        }
        this.normalizer = normalizer;
        this.extractor = extractor;
        this.examplesPerGroup = examplesPerGroup;
        this.maxTokensPerGroup = maxTokensPerGroup;
    }

    public void add(LogEvent event) {
        String signature = normalizer.normalize(event.message());
        Accumulator acc = groups.computeIfAbsent(signature, Accumulator::new);
        acc.count++;
        acc.levelCounts.merge(event.level(), 1, Integer::sum);
        if (acc.examples.size() < examplesPerGroup) {
            acc.examples.add(event.rawLine());
        }
        for (String token : extractor.extract(event.message())) {
            acc.countToken(token, 1, maxTokensPerGroup);
        }
        eventCount++;
    }

    /**
     * Folds another aggregator's groups into this one. The other aggregator is left untouched.
     */
    public GroupAggregator merge(GroupAggregator other) {
        if (other == this) {
            throw new IllegalArgumentException("cannot merge an aggregator into itself");
        }
        for (Accumulator theirs : other.groups.values()) {
            Accumulator mine = groups.computeIfAbsent(theirs.signature, Accumulator::new);
            mine.count += theirs.count;
            theirs.levelCounts.forEach((level, n) -> mine.levelCounts.merge(level, n, Integer::sum));
            for (String example : theirs.examples) {
                if (mine.examples.size() >= examplesPerGroup) {
                    break;
                }
                mine.examples.add(example);
            }
            theirs.tokenCounts.forEach((token, n) -> mine.countToken(token, n, maxTokensPerGroup));
        }
        eventCount += other.eventCount;
        return this;
    }

    public int eventCount() {
        return eventCount;
    }

    public int groupCount() {
        return groups.size();
    }

    /**
     * Snapshot of all groups, descending by count with ties broken by signature.
     */
    public List<LogGroup> finalizeGroups() {
        return groups.values().stream()
                .map(Accumulator::toGroup)
                .sorted(GROUP_ORDER)
                .collect(Collectors.toList());
    }

    private static final class Accumulator {
        private final String signature;
        private int count;
        private final Map<LogLevel, Integer> levelCounts = new EnumMap<>(LogLevel.class);
        private final List<String> examples = new ArrayList<>();
        private final Map<String, Integer> tokenCounts = new HashMap<>();

        private Accumulator(String signature) {
            this.signature = signature;
        }

        private void countToken(String token, int n, int cap) {
            if (tokenCounts.containsKey(token) || tokenCounts.size() < cap) {
                tokenCounts.merge(token, n, Integer::sum);
            }
        }

        private LogGroup toGroup() {
            Set<String> tokens = tokenCounts.entrySet().stream()
                    .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                            .thenComparing(Map.Entry.comparingByKey()))
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            return new LogGroup(signature, count, levelCounts, examples, tokens);
        }
    }
}
