package com.eainde.loganalyzer.llm;

import java.time.Duration;

/**
 * Per-call options handed to the {@link LlmTransport}.
 *
 * @param model       model id, e.g. {@code gpt-4o-mini} or {@code mistral:latest}
 * @param temperature sampling temperature, null leaves the provider default
 * @param timeout     hard limit for a single attempt
 */
public record LlmOptions(String model, Double temperature, Duration timeout) {
}
