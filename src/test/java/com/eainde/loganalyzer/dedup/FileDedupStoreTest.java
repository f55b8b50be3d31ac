package com.eainde.loganalyzer.dedup;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class FileDedupStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    @Test
    void reportsWhetherKeyExistedAndPersistsIt() throws Exception {
        Path file = dir.resolve("nested/created_bugs.json");
        FileDedupStore store = new FileDedupStore(objectMapper, file, clock);
        String key = DedupStore.dailyKey(LocalDate.of(2024, 1, 1), "nullpointerexception at <loc>");

        assertThat(store.checkAndSet(key)).isFalse();
        assertThat(store.checkAndSet(key)).isTrue();

        assertThat(objectMapper.readTree(file.toFile()).get("2024-01-01|nullpointerexception at <loc>").asText())
                .isEqualTo("2024-01-01T12:00:00Z");
    }

    @Test
    void survivesAcrossInstances() {
        Path file = dir.resolve("created_bugs.json");

        new FileDedupStore(objectMapper, file, clock).checkAndSet("k");

        assertThat(new FileDedupStore(objectMapper, file, clock).checkAndSet("k")).isTrue();
        assertThat(new FileDedupStore(objectMapper, file, clock).checkAndSet("other")).isFalse();
    }

    @Test
    void keepsExistingKeysWrittenByOthers() throws Exception {
        Path file = dir.resolve("created_bugs.json");
        Files.writeString(file, "{\"2024-01-01|disk low\": \"JIRA-12\"}");

        FileDedupStore store = new FileDedupStore(objectMapper, file, clock);

        assertThat(store.checkAndSet("2024-01-01|disk low")).isTrue();
        assertThat(store.checkAndSet("2024-01-01|other")).isFalse();
        assertThat(objectMapper.readTree(file.toFile()).get("2024-01-01|disk low").asText()).isEqualTo("JIRA-12");
    }

    @Test
    void inMemoryStoreHasSameContract() {
        DedupStore store = new InMemoryDedupStore();

        assertThat(store.checkAndSet("k")).isFalse();
        assertThat(store.checkAndSet("k")).isTrue();
    }
}
