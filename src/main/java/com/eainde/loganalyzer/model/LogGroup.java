package com.eainde.loganalyzer.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finalized statistics for every event sharing one signature. Read-only once produced.
 *
 * @param signature       grouping key
 * @param count           number of events, always at least 1
 * @param levelCounts     per-level histogram, one entry for every {@link LogLevel}
 * @param examples        first-seen raw lines, at most the configured cap
 * @param exceptionTokens exception evidence, most frequent first
 */
public record LogGroup(
        String signature,
        int count,
        Map<LogLevel, Integer> levelCounts,
        List<String> examples,
        Set<String> exceptionTokens
) implements Serializable {
    public LogGroup {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1 but was " + count);
        }
        EnumMap<LogLevel, Integer> levels = new EnumMap<>(LogLevel.class);
        for (LogLevel level : LogLevel.values()) {
            levels.put(level, levelCounts.getOrDefault(level, 0));
        }
        levelCounts = Collections.unmodifiableMap(levels);
        examples = List.copyOf(examples);
        exceptionTokens = Collections.unmodifiableSet(new LinkedHashSet<>(exceptionTokens));
    }

    public int levelCount(LogLevel level) {
        return levelCounts.get(level);
    }

    public int errorCount() {
        return levelCount(LogLevel.ERROR);
    }

    /** ERROR events divided by all events of the group. */
    public double errorRate() {
        return (double) errorCount() / count;
    }
}
