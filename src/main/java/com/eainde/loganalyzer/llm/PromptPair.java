package com.eainde.loganalyzer.llm;

/**
 * System and user prompt of one synthesis request.
 */
public record PromptPair(String systemPrompt, String userPrompt) {
}
