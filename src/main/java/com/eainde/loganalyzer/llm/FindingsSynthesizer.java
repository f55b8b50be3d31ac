package com.eainde.loganalyzer.llm;

import com.eainde.loganalyzer.model.CandidateFinding;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the model with a built prompt and turns its answer into candidate findings.
 *
 * <h3>Transport:</h3>
 * Each attempt runs on the supplied executor and is abandoned after {@link LlmOptions#timeout()}.
 * Failed or timed-out attempts are retried up to {@code maxAttempts} times with a doubling delay
 * starting at {@code initialBackoff}. When every attempt fails a {@link TransportException} is thrown.
 *
 * <h3>Parsing:</h3>
 * The answer is untrusted. Markdown fences and surrounding prose are tolerated, and both a bare
 * array and an object wrapping it under {@code findings} or {@code groups} are accepted. Anything
 * else yields an empty list; the raw text is then saved as {@code last_raw.json} for inspection.
 */
@Slf4j
public class FindingsSynthesizer {

    static final String RAW_OUTPUT_FILE = "last_raw.json";

    private final LlmTransport transport;
    private final ObjectMapper objectMapper;
    private final LlmOptions options;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Executor executor;
    private final Path rawOutputDir;

    /**
     * @param rawOutputDir where unparsable answers are saved, null to skip saving
     */
    public FindingsSynthesizer(LlmTransport transport,
                               ObjectMapper objectMapper,
                               LlmOptions options,
                               int maxAttempts,
                               Duration initialBackoff,
                               Executor executor,
                               Path rawOutputDir) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.options = options;
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.executor = executor;
        this.rawOutputDir = rawOutputDir;
    }

    /** Model id the synthesizer talks to. */
    public String model() {
        return options.model();
    }

    public List<CandidateFinding> synthesize(PromptPair prompt) {
        return synthesize(prompt.systemPrompt(), prompt.userPrompt());
    }

    /**
     * @return candidate findings, possibly empty, never null
     * @throws TransportException when the model stayed unreachable after all attempts
     */
    public List<CandidateFinding> synthesize(String systemPrompt, String userPrompt) {
        String raw = callWithRetry(systemPrompt, userPrompt);
        List<CandidateFinding> candidates = parseCandidates(raw);
        log.info("Model returned {} candidate findings", candidates.size());
        return candidates;
    }

    // =========================================================================
    //  Transport
    // =========================================================================

    private String callWithRetry(String systemPrompt, String userPrompt) {
        Exception lastFailure = null;
        Duration delay = initialBackoff;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                log.info("Calling model {} (attempt {}/{})", options.model(), attempt, maxAttempts);
                return callOnce(systemPrompt, userPrompt);
            } catch (TimeoutException e) {
                lastFailure = e;
                log.warn("Model call timed out after {} (attempt {}/{})", options.timeout(), attempt, maxAttempts);
            } catch (ExecutionException e) {
                lastFailure = e.getCause() instanceof Exception ? (Exception) e.getCause() : e;
                log.warn("Model call failed (attempt {}/{}): {}", attempt, maxAttempts, lastFailure.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("Interrupted while calling model " + options.model(), attempt, e);
            }

            if (attempt < maxAttempts && !delay.isZero()) {
                sleep(delay, attempt);
                delay = delay.multipliedBy(2);
            }
        }
        throw new TransportException("Model " + options.model() + " unreachable after "
                + maxAttempts + " attempts", maxAttempts, lastFailure);
    }

    private String callOnce(String systemPrompt, String userPrompt)
            throws InterruptedException, ExecutionException, TimeoutException {
        CompletableFuture<String> call = CompletableFuture.supplyAsync(
                () -> transport.complete(systemPrompt, userPrompt, options), executor);
        try {
            return call.get(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw e;
        }
    }

    private void sleep(Duration delay, int attempt) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while backing off", attempt, e);
        }
    }

    // =========================================================================
    //  Parsing
    // =========================================================================

    /**
     * Lenient parse of a model answer. Never throws.
     */
    public List<CandidateFinding> parseCandidates(String raw) {
        if (raw == null || raw.isBlank()) {
            log.warn("Model returned an empty answer");
            return Collections.emptyList();
        }
        JsonNode array = findingsArray(readLenient(raw));
        if (array == null) {
            log.warn("Model answer is not a JSON array of findings; continuing without candidates");
            saveRaw(raw);
            return Collections.emptyList();
        }

        List<CandidateFinding> candidates = new ArrayList<>();
        for (JsonNode element : array) {
            if (element.isObject()) {
                candidates.add(toCandidate(element));
            }
        }
        if (candidates.size() < array.size()) {
            log.warn("Skipped {} non-object entries in model answer", array.size() - candidates.size());
        }
        return candidates;
    }

    private JsonNode readLenient(String raw) {
        String cleaned = stripFences(raw.strip());
        JsonNode node = tryRead(cleaned);
        if (node != null) {
            return node;
        }
        node = tryRead(slice(cleaned, '[', ']'));
        if (node != null) {
            return node;
        }
        return tryRead(slice(cleaned, '{', '}'));
    }

    private JsonNode findingsArray(JsonNode root) {
        if (root == null) {
            return null;
        }
        if (root.isArray()) {
            return root;
        }
        if (root.isObject()) {
            for (String key : List.of("findings", "groups")) {
                JsonNode candidate = root.get(key);
                if (candidate != null && candidate.isArray()) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private CandidateFinding toCandidate(JsonNode node) {
        String signature = text(node, "signature_ref");
        if (signature == null) {
            signature = text(node, "signature");
        }
        JsonNode total = node.get("total_events");
        JsonNode rate = node.get("error_rate");
        return new CandidateFinding(
                signature,
                total != null && total.isNumber() ? total.asInt() : null,
                rate != null && rate.isNumber() ? rate.asDouble() : null,
                text(node, "probable_root_cause"),
                text(node, "severity"),
                text(node, "recommendation"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private JsonNode tryRead(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (IOException e) {
            return null;
        }
    }

    private static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        String body = text.substring(3);
        int firstNewline = body.indexOf('\n');
        body = firstNewline >= 0 ? body.substring(firstNewline + 1) : body;
        int closing = body.lastIndexOf("```");
        return (closing >= 0 ? body.substring(0, closing) : body).strip();
    }

    private static String slice(String text, char open, char close) {
        int start = text.indexOf(open);
        int end = text.lastIndexOf(close);
        return start >= 0 && end > start ? text.substring(start, end + 1) : null;
    }

    private void saveRaw(String raw) {
        if (rawOutputDir == null) {
            return;
        }
        Path target = rawOutputDir.resolve(RAW_OUTPUT_FILE);
        try {
            Files.createDirectories(rawOutputDir);
            Files.writeString(target, raw, StandardCharsets.UTF_8);
            log.warn("Raw model answer saved to {}", target);
        } catch (IOException e) {
            log.warn("Could not save raw model answer to {}", target, e);
        }
    }
}
