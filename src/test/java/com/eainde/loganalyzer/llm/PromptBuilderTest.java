package com.eainde.loganalyzer.llm;

import com.eainde.loganalyzer.aggregate.GroupAggregator;
import com.eainde.loganalyzer.model.LogGroup;
import com.eainde.loganalyzer.model.LogLevel;
import com.eainde.loganalyzer.parse.EventParser;
import com.eainde.loganalyzer.parse.ExceptionExtractor;
import com.eainde.loganalyzer.parse.SignatureNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntFunction;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private static final String HEADER = "INPUT payload (pre-aggregated groups and totals):\n";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static LogGroup group(String signature, int count, int errors, String example) {
        return new LogGroup(signature, count,
                Map.of(LogLevel.ERROR, errors, LogLevel.INFO, count - errors),
                List.of(example),
                Set.of("NullPointerException"));
    }

    private JsonNode payload(PromptPair prompt) throws Exception {
        String user = prompt.userPrompt();
        int end = user.indexOf("\n\n");
        return objectMapper.readTree(user.substring(HEADER.length(), end < 0 ? user.length() : end));
    }

    @Test
    void serializesEveryGroupFieldAndTotals() throws Exception {
        PromptBuilder builder = new PromptBuilder(objectMapper, 20, 240);

        PromptPair prompt = builder.build(List.of(
                group("nullpointerexception at <loc>", 2, 2, "2024-01-01 10:00:00 ERROR NullPointerException at Foo.java:42"),
                group("service started", 1, 0, "2024-01-01 10:00:10 INFO Service started")));

        assertThat(prompt.systemPrompt())
                .contains("signature_ref", "total_events", "error_rate", "probable_root_cause");
        assertThat(prompt.userPrompt()).startsWith(HEADER).doesNotContain("omitted");

        JsonNode payload = payload(prompt);
        assertThat(payload.get("total_events").asInt()).isEqualTo(3);
        assertThat(payload.get("total_groups").asInt()).isEqualTo(2);
        JsonNode first = payload.get("groups").get(0);
        assertThat(first.get("signature").asText()).isEqualTo("nullpointerexception at <loc>");
        assertThat(first.get("count").asInt()).isEqualTo(2);
        assertThat(first.get("level_counts").get("ERROR").asInt()).isEqualTo(2);
        assertThat(first.get("level_counts").get("WARN").asInt()).isZero();
        assertThat(first.get("exception_tokens").get(0).asText()).isEqualTo("NullPointerException");
        assertThat(first.get("examples")).hasSize(1);
    }

    @Test
    void capsGroupsAndNotesTheOmittedCount() throws Exception {
        PromptBuilder builder = new PromptBuilder(objectMapper, 1, 240);

        PromptPair prompt = builder.build(List.of(
                group("a", 5, 5, "a"),
                group("b", 3, 0, "b"),
                group("c", 1, 0, "c")));

        assertThat(payload(prompt).get("groups")).hasSize(1);
        assertThat(payload(prompt).get("omitted_groups").asInt()).isEqualTo(2);
        assertThat(payload(prompt).get("total_events").asInt()).isEqualTo(9);
        assertThat(prompt.userPrompt()).contains("2 more groups omitted");
    }

    @Test
    void nonPositiveCapSendsAllGroups() throws Exception {
        PromptBuilder builder = new PromptBuilder(objectMapper, 0, 240);

        PromptPair prompt = builder.build(List.of(group("a", 1, 0, "a"), group("b", 1, 0, "b")));

        assertThat(payload(prompt).get("groups")).hasSize(2);
        assertThat(payload(prompt).has("omitted_groups")).isFalse();
    }

    @Test
    void truncatesLongExamples() throws Exception {
        PromptBuilder builder = new PromptBuilder(objectMapper, 20, 10);

        PromptPair prompt = builder.build(List.of(group("a", 1, 1, "0123456789abcdef")));

        assertThat(payload(prompt).get("groups").get(0).get("examples").get(0).asText())
                .isEqualTo("0123456789...");
    }

    @Test
    void isDeterministic() {
        PromptBuilder builder = new PromptBuilder(objectMapper, 20, 240);
        List<LogGroup> groups = List.of(group("a", 2, 1, "x"), group("b", 1, 0, "y"));

        assertThat(builder.build(groups)).isEqualTo(builder.build(groups));
    }

    @Test
    void sendsOnlyTheMostFrequentTokensPerGroup() throws Exception {
        PromptBuilder builder = new PromptBuilder(objectMapper, 20, 240, 2);
        Set<String> tokens = new LinkedHashSet<>(List.of("TimeoutException", "IOException", "SocketException"));
        LogGroup group = new LogGroup("call failed", 3, Map.of(LogLevel.ERROR, 3), List.of("x"), tokens);

        JsonNode sent = payload(builder.build(List.of(group))).get("groups").get(0).get("exception_tokens");

        assertThat(sent).hasSize(2);
        assertThat(sent.get(0).asText()).isEqualTo("TimeoutException");
        assertThat(sent.get(1).asText()).isEqualTo("IOException");
    }

    @Nested
    @DisplayName("prompt size")
    class PromptSize {

        private final EventParser parser = new EventParser();

        private PromptPair promptFor(int events, SignatureNormalizer normalizer, IntFunction<String> line) {
            GroupAggregator aggregator = new GroupAggregator(normalizer, new ExceptionExtractor(), 3, 20);
            for (int i = 0; i < events; i++) {
                parser.parse(line.apply(i)).ifPresent(aggregator::add);
            }
            return new PromptBuilder(objectMapper, 20, 240, 5).build(aggregator.finalizeGroups());
        }

        @Test
        @DisplayName("does not grow with the number of events carrying variable data")
        void boundedForVariableMarkerText() throws Exception {
            IntFunction<String> line =
                    i -> "2024-01-01 10:00:00 ERROR Request failed, Exception: user " + i + " not found";

            PromptPair small = promptFor(10, SignatureNormalizer.defaults(), line);
            PromptPair large = promptFor(20_000, SignatureNormalizer.defaults(), line);

            // only the digits of the two counters differ
            assertThat(large.userPrompt().length()).isLessThanOrEqualTo(small.userPrompt().length() + 10);
            assertThat(payload(large).get("groups").get(0).get("exception_tokens")).hasSize(1);
        }

        @Test
        @DisplayName("stays bounded when every event carries a distinct exception text")
        void boundedForDistinctMarkerText() throws Exception {
            // three-token signatures keep every event in one group while the marker text differs
            SignatureNormalizer coarse = SignatureNormalizer.builder().maxTokens(3).build();
            IntFunction<String> line =
                    i -> "2024-01-01 10:00:00 ERROR Request failed, Exception: code " + letters(i);

            PromptPair small = promptFor(50, coarse, line);
            PromptPair large = promptFor(20_000, coarse, line);

            JsonNode group = payload(large).get("groups").get(0);
            assertThat(group.get("count").asInt()).isEqualTo(20_000);
            assertThat(group.get("exception_tokens")).hasSize(5);
            assertThat(large.userPrompt().length()).isLessThanOrEqualTo(small.userPrompt().length() + 10);
        }

        private String letters(int n) {
            StringBuilder sb = new StringBuilder();
            do {
                sb.append((char) ('a' + n % 26));
                n /= 26;
            } while (n > 0);
            return sb.toString();
        }
    }
}
