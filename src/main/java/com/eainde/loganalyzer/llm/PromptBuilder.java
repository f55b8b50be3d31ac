package com.eainde.loganalyzer.llm;

import com.eainde.loganalyzer.model.LogGroup;
import com.eainde.loganalyzer.model.LogLevel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Serializes aggregated groups into the system/user prompt pair sent to the model.
 *
 * <p>Output is deterministic for a given group list. At most {@code maxGroups} groups are sent
 * ({@code <= 0} sends all of them); the rest are reported as an omitted count. Example lines
 * are cut at {@code maxExampleLength} characters. Each group sends its {@code maxTokensPerGroup}
 * most frequent exception tokens, so the prompt size does not grow with the event count.</p>
 */
public class PromptBuilder {

    static final String SYSTEM_PROMPT = """
            You are a concise QA log analysis assistant.
            You receive pre-aggregated log groups. Each group has a `signature`, an event `count`,
            a `level_counts` histogram, extracted `exception_tokens` and a few raw `examples`.

            Return JSON ONLY (no prose, no Markdown fences): a JSON array with exactly one object
            per input group. Do NOT invent, drop or rename groups and keep the input order.
            Each object must have these keys:
              - "signature_ref": the group's `signature`, echoed exactly
              - "total_events": the group's `count` (integer)
              - "error_rate": ERROR count divided by `count` (number between 0 and 1)
              - "probable_root_cause": the most likely root cause, <= 200 characters
              - "severity": one of "LOW", "MEDIUM", "HIGH", "CRITICAL"
              - "recommendation": the next step an engineer should take, <= 200 characters
            Do not add other keys.
            """;

    /** Exception tokens sent per group when no cap is given. */
    public static final int DEFAULT_MAX_TOKENS_PER_GROUP = 5;

    private final ObjectMapper objectMapper;
    private final int maxGroups;
    private final int maxExampleLength;
    private final int maxTokensPerGroup;

    public PromptBuilder(ObjectMapper objectMapper, int maxGroups, int maxExampleLength) {
        this(objectMapper, maxGroups, maxExampleLength, DEFAULT_MAX_TOKENS_PER_GROUP);
    }

    public PromptBuilder(ObjectMapper objectMapper, int maxGroups, int maxExampleLength, int maxTokensPerGroup) {
        if (maxExampleLength < 1) {
            throw new IllegalArgumentException("maxExampleLength must be >= 1");
        }
        if (maxTokensPerGroup < 0) {
            throw new IllegalArgumentException("maxTokensPerGroup must be >= 0");
        }
        this.objectMapper = objectMapper;
        this.maxGroups = maxGroups;
        this.maxExampleLength = maxExampleLength;
        this.maxTokensPerGroup = maxTokensPerGroup;
    }

    public PromptPair build(List<LogGroup> groups) {
        int included = maxGroups <= 0 ? groups.size() : Math.min(maxGroups, groups.size());
        int omitted = groups.size() - included;
        int totalEvents = groups.stream().mapToInt(LogGroup::count).sum();

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("total_events", totalEvents);
        payload.put("total_groups", groups.size());
        ArrayNode groupArray = payload.putArray("groups");
        for (LogGroup group : groups.subList(0, included)) {
            groupArray.add(toNode(group));
        }
        if (omitted > 0) {
            payload.put("omitted_groups", omitted);
        }

        StringBuilder user = new StringBuilder();
        user.append("INPUT payload (pre-aggregated groups and totals):\n");
        user.append(writeJson(payload));
        if (omitted > 0) {
            user.append("\n\n").append(omitted).append(" more groups omitted (lower event counts).")
                    .append(" Return findings only for the groups listed above.");
        }
        return new PromptPair(SYSTEM_PROMPT, user.toString());
    }

    private ObjectNode toNode(LogGroup group) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("signature", group.signature());
        node.put("count", group.count());
        ObjectNode levels = node.putObject("level_counts");
        for (LogLevel level : LogLevel.values()) {
            levels.put(level.name(), group.levelCount(level));
        }
        ArrayNode tokens = node.putArray("exception_tokens");
        // exceptionTokens() is ordered by descending frequency
        group.exceptionTokens().stream().limit(maxTokensPerGroup).forEach(tokens::add);
        ArrayNode examples = node.putArray("examples");
        for (String example : group.examples()) {
            examples.add(example.length() > maxExampleLength
                    ? example.substring(0, maxExampleLength) + "..."
                    : example);
        }
        return node;
    }

    private String writeJson(ObjectNode payload) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize prompt payload", e);
        }
    }
}
