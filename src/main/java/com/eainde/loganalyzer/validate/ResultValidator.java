package com.eainde.loganalyzer.validate;

import com.eainde.loganalyzer.model.CandidateFinding;
import com.eainde.loganalyzer.model.Finding;
import com.eainde.loganalyzer.model.LogEvent;
import com.eainde.loganalyzer.model.LogGroup;
import com.eainde.loganalyzer.model.Severity;
import com.eainde.loganalyzer.parse.EventParser;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reconciles untrusted model candidates with the aggregated groups.
 *
 * <ul>
 *   <li>Exactly one finding per group, in group order.</li>
 *   <li>{@code total_events} and {@code error_rate} always come from the group.</li>
 *   <li>The model may only contribute root cause, severity and recommendation. Missing, blank or
 *       placeholder root causes are replaced from the group's exception tokens, or else from the
 *       leading clause of its most frequent example.</li>
 *   <li>Model root causes and recommendations are cut to {@value #MAX_MODEL_TEXT} characters.</li>
 *   <li>Candidates for unknown signatures are dropped. When the model repeats a signature the
 *       first usable candidate wins.</li>
 * </ul>
 */
@Slf4j
public class ResultValidator {

    /** Exception tokens joined into a fallback root cause. */
    static final int FALLBACK_TOKENS = 3;
    static final int MAX_CLAUSE_LENGTH = 160;
    static final int MAX_MODEL_TEXT = 200;
    static final String NO_EVIDENCE = "No exception evidence; see example lines";

    private static final Set<String> PLACEHOLDERS = Set.of(
            "", "n/a", "na", "none", "null", "unknown", "tbd", "todo", "...", "-", "?",
            "string", "probable_root_cause", "probable root cause", "<probable_root_cause>",
            "<probable root cause>", "root cause", "<root cause>", "not available", "not determined");

    private static final Pattern CLAUSE_END = Pattern.compile("[.;,:(\\[]|\\s-\\s");

    private final EventParser eventParser;

    public ResultValidator(EventParser eventParser) {
        this.eventParser = eventParser;
    }

    public List<Finding> validate(List<LogGroup> groups, List<CandidateFinding> candidates) {
        Map<String, LogGroup> known = new HashMap<>();
        groups.forEach(g -> known.put(g.signature(), g));

        Map<String, CandidateFinding> bySignature = new LinkedHashMap<>();
        int dropped = 0;
        for (CandidateFinding candidate : candidates) {
            String signature = candidate.signatureRef() == null ? null : candidate.signatureRef().strip();
            if (signature == null || !known.containsKey(signature)) {
                dropped++;
                continue;
            }
            CandidateFinding existing = bySignature.get(signature);
            if (existing == null || (isPlaceholder(existing.probableRootCause())
                    && !isPlaceholder(candidate.probableRootCause()))) {
                bySignature.put(signature, candidate);
            }
        }
        if (dropped > 0) {
            log.warn("Dropped {} candidate findings with missing or unknown signatures", dropped);
        }

        List<Finding> findings = new ArrayList<>(groups.size());
        int synthesized = 0;
        for (LogGroup group : groups) {
            CandidateFinding candidate = bySignature.get(group.signature());
            if (candidate == null) {
                synthesized++;
            }
            findings.add(reconcile(group, candidate));
        }
        if (synthesized > 0) {
            log.info("Synthesized {} of {} findings without model input", synthesized, groups.size());
        }
        return findings;
    }

    private Finding reconcile(LogGroup group, CandidateFinding candidate) {
        String rootCause = candidate == null ? null : candidate.probableRootCause();
        Severity severity = candidate == null ? null : Severity.parse(candidate.severity()).orElse(null);
        String recommendation = candidate == null || isPlaceholder(candidate.recommendation())
                ? null
                : cut(candidate.recommendation().strip(), MAX_MODEL_TEXT);

        if (isPlaceholder(rootCause)) {
            rootCause = fallbackRootCause(group);
            if (recommendation == null && !group.exceptionTokens().isEmpty()) {
                recommendation = "Investigate " + group.exceptionTokens().iterator().next()
                        + " and related services";
            }
        } else {
            rootCause = cut(rootCause.strip(), MAX_MODEL_TEXT);
        }

        return new Finding(
                group.signature(),
                group.count(),
                group.errorRate(),
                rootCause,
                severity,
                recommendation,
                group.levelCounts(),
                group.examples());
    }

    /**
     * Root cause derived from the group alone: the top exception tokens, or the leading clause
     * of the most frequent example line.
     */
    String fallbackRootCause(LogGroup group) {
        if (!group.exceptionTokens().isEmpty()) {
            return group.exceptionTokens().stream()
                    .limit(FALLBACK_TOKENS)
                    .collect(Collectors.joining(", "));
        }
        String example = mostFrequentExample(group.examples());
        if (example == null) {
            return NO_EVIDENCE;
        }
        String message = eventParser.parse(example).map(LogEvent::message).orElse(example.strip());
        String clause = leadingClause(message);
        return clause.isEmpty() ? NO_EVIDENCE : clause;
    }

    static boolean isPlaceholder(String text) {
        return text == null || PLACEHOLDERS.contains(text.strip().toLowerCase(Locale.ROOT));
    }

    private static String mostFrequentExample(List<String> examples) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        examples.forEach(e -> counts.merge(e, 1, Integer::sum));
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private static String leadingClause(String message) {
        String clause = CLAUSE_END.split(message, 2)[0].strip();
        if (clause.isEmpty()) {
            clause = message.strip();
        }
        return cut(clause, MAX_CLAUSE_LENGTH);
    }

    private static String cut(String text, int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength).strip() : text;
    }
}
