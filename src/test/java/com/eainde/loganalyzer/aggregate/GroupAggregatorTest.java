package com.eainde.loganalyzer.aggregate;

import com.eainde.loganalyzer.model.LogEvent;
import com.eainde.loganalyzer.model.LogGroup;
import com.eainde.loganalyzer.model.LogLevel;
import com.eainde.loganalyzer.parse.EventParser;
import com.eainde.loganalyzer.parse.ExceptionExtractor;
import com.eainde.loganalyzer.parse.SignatureNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class GroupAggregatorTest {

    private final EventParser parser = new EventParser();

    private GroupAggregator newAggregator(int examples) {
        return new GroupAggregator(SignatureNormalizer.defaults(), new ExceptionExtractor(), examples);
    }

    private void feed(GroupAggregator aggregator, String... lines) {
        for (String line : lines) {
            parser.parse(line).ifPresent(aggregator::add);
        }
    }

    @Test
    void buildsGroupsForNullPointerScenario() {
        // Arrange
        GroupAggregator aggregator = newAggregator(3);

        // Act
        feed(aggregator,
                "2024-01-01 10:00:00 ERROR NullPointerException at Foo.java:42",
                "2024-01-01 10:00:05 ERROR NullPointerException at Bar.java:17",
                "2024-01-01 10:00:10 INFO Service started");
        List<LogGroup> groups = aggregator.finalizeGroups();

        // Assert
        assertThat(groups).hasSize(2);
        LogGroup npe = groups.get(0);
        assertThat(npe.signature()).isEqualTo("nullpointerexception at <loc>");
        assertThat(npe.count()).isEqualTo(2);
        assertThat(npe.errorRate()).isEqualTo(1.0);
        assertThat(npe.exceptionTokens()).containsExactly("NullPointerException");
        assertThat(npe.examples()).hasSize(2);

        LogGroup started = groups.get(1);
        assertThat(started.signature()).isEqualTo("service started");
        assertThat(started.count()).isEqualTo(1);
        assertThat(started.errorRate()).isEqualTo(0.0);
        assertThat(started.levelCount(LogLevel.INFO)).isEqualTo(1);
        assertThat(aggregator.eventCount()).isEqualTo(3);
    }

    @Test
    void ordersByDescendingCountThenSignature() {
        GroupAggregator aggregator = newAggregator(3);
        feed(aggregator,
                "2024-01-01 10:00:00 INFO zeta",
                "2024-01-01 10:00:00 INFO alpha",
                "2024-01-01 10:00:00 INFO beta",
                "2024-01-01 10:00:00 INFO beta");

        assertThat(aggregator.finalizeGroups())
                .extracting(LogGroup::signature)
                .containsExactly("beta", "alpha", "zeta");
    }

    @Test
    void keepsFirstSeenExamplesUpToCap() {
        GroupAggregator aggregator = newAggregator(2);
        feed(aggregator,
                "2024-01-01 10:00:01 ERROR timeout after 1 ms",
                "2024-01-01 10:00:02 ERROR timeout after 2 ms",
                "2024-01-01 10:00:03 ERROR timeout after 3 ms");

        LogGroup group = aggregator.finalizeGroups().get(0);
        assertThat(group.count()).isEqualTo(3);
        assertThat(group.examples()).containsExactly(
                "2024-01-01 10:00:01 ERROR timeout after 1 ms",
                "2024-01-01 10:00:02 ERROR timeout after 2 ms");
    }

    @Test
    void ranksExceptionTokensByFrequency() {
        GroupAggregator aggregator = new GroupAggregator(
                SignatureNormalizer.builder().maxTokens(2).build(), new ExceptionExtractor(), 3);
        aggregator.add(new LogEvent(null, LogLevel.ERROR, "call failed: IOException", "l1"));
        aggregator.add(new LogEvent(null, LogLevel.ERROR, "call failed: TimeoutException", "l2"));
        aggregator.add(new LogEvent(null, LogLevel.ERROR, "call failed: TimeoutException", "l3"));

        LogGroup group = aggregator.finalizeGroups().get(0);
        assertThat(group.exceptionTokens()).containsExactly("TimeoutException", "IOException");
    }

    @Test
    void markerTextWithVariableDataCountsAsOneToken() {
        GroupAggregator aggregator = newAggregator(3);
        for (int i = 0; i < 5000; i++) {
            feed(aggregator, "2024-01-01 10:00:00 ERROR Request failed, Exception: user " + i + " not found");
        }

        LogGroup group = aggregator.finalizeGroups().get(0);
        assertThat(aggregator.groupCount()).isEqualTo(1);
        assertThat(group.count()).isEqualTo(5000);
        assertThat(group.exceptionTokens()).containsExactly("user <num> not found");
    }

    @Test
    void stopsTrackingNewTokensPastTheCap() {
        GroupAggregator aggregator = new GroupAggregator(
                SignatureNormalizer.builder().maxTokens(2).build(), new ExceptionExtractor(), 3, 2);
        aggregator.add(new LogEvent(null, LogLevel.ERROR, "call failed: AlphaException", "l1"));
        aggregator.add(new LogEvent(null, LogLevel.ERROR, "call failed: BetaException", "l2"));
        aggregator.add(new LogEvent(null, LogLevel.ERROR, "call failed: GammaException", "l3"));
        aggregator.add(new LogEvent(null, LogLevel.ERROR, "call failed: AlphaException", "l4"));

        LogGroup group = aggregator.finalizeGroups().get(0);
        assertThat(group.count()).isEqualTo(4);
        assertThat(group.exceptionTokens()).containsExactly("AlphaException", "BetaException");
    }

    @Test
    void rejectsNegativeTokenCap() {
        assertThatThrownBy(() -> new GroupAggregator(
                SignatureNormalizer.defaults(), new ExceptionExtractor(), 3, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("merge()")
    class Merge {

        @Test
        @DisplayName("sums counts and histograms and caps examples")
        void sumsOverlappingGroups() {
            // Arrange
            GroupAggregator first = newAggregator(3);
            GroupAggregator second = newAggregator(3);
            feed(first,
                    "2024-01-01 10:00:00 ERROR NullPointerException at Foo.java:42",
                    "2024-01-01 10:00:01 ERROR NullPointerException at Foo.java:43",
                    "2024-01-01 10:00:02 WARN disk low");
            feed(second,
                    "2024-01-01 11:00:00 ERROR NullPointerException at Bar.java:1",
                    "2024-01-01 11:00:01 INFO NullPointerException at Baz.java:2",
                    "2024-01-01 11:00:02 INFO Service started");

            // Act
            List<LogGroup> groups = first.merge(second).finalizeGroups();

            // Assert
            assertThat(groups).extracting(LogGroup::signature)
                    .containsExactly("nullpointerexception at <loc>", "disk low", "service started");
            LogGroup npe = groups.get(0);
            assertThat(npe.count()).isEqualTo(4);
            assertThat(npe.levelCount(LogLevel.ERROR)).isEqualTo(3);
            assertThat(npe.levelCount(LogLevel.INFO)).isEqualTo(1);
            assertThat(npe.examples()).hasSize(3)
                    .startsWith("2024-01-01 10:00:00 ERROR NullPointerException at Foo.java:42");
            assertThat(npe.exceptionTokens()).containsExactly("NullPointerException");
            assertThat(first.eventCount()).isEqualTo(6);
        }

        @Test
        @DisplayName("is commutative for counts")
        void commutativeCounts() {
            GroupAggregator a1 = newAggregator(3);
            GroupAggregator b1 = newAggregator(3);
            GroupAggregator a2 = newAggregator(3);
            GroupAggregator b2 = newAggregator(3);
            String[] left = {"2024-01-01 10:00:00 ERROR x failed", "2024-01-01 10:00:00 INFO y ok"};
            String[] right = {"2024-01-01 10:00:00 WARN x failed", "2024-01-01 10:00:00 INFO z ok"};
            feed(a1, left);
            feed(a2, left);
            feed(b1, right);
            feed(b2, right);

            List<LogGroup> ab = a1.merge(b1).finalizeGroups();
            List<LogGroup> ba = b2.merge(a2).finalizeGroups();

            assertThat(ab).extracting(LogGroup::signature, LogGroup::count, LogGroup::levelCounts)
                    .containsExactlyElementsOf(
                            ba.stream().map(g -> tuple(
                                    g.signature(), g.count(), g.levelCounts())).toList());
        }

        @Test
        @DisplayName("keeps the token cap across merged aggregators")
        void tokenCapHoldsAcrossMerge() {
            SignatureNormalizer normalizer = SignatureNormalizer.builder().maxTokens(2).build();
            GroupAggregator first = new GroupAggregator(normalizer, new ExceptionExtractor(), 3, 2);
            GroupAggregator second = new GroupAggregator(normalizer, new ExceptionExtractor(), 3, 2);
            first.add(new LogEvent(null, LogLevel.ERROR, "call failed: AlphaException", "l1"));
            second.add(new LogEvent(null, LogLevel.ERROR, "call failed: BetaException", "l2"));
            second.add(new LogEvent(null, LogLevel.ERROR, "call failed: GammaException", "l3"));

            LogGroup group = first.merge(second).finalizeGroups().get(0);

            assertThat(group.count()).isEqualTo(3);
            assertThat(group.exceptionTokens()).hasSize(2).contains("AlphaException");
        }

        @Test
        void rejectsSelfMerge() {
            GroupAggregator aggregator = newAggregator(3);

            assertThatThrownBy(() -> aggregator.merge(aggregator))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
