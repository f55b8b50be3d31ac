package com.eainde.loganalyzer.llm;

/**
 * Request/response access to a chat model. Implementations return the raw assistant text and
 * make no promise about its shape.
 */
public interface LlmTransport {

    /**
     * @throws RuntimeException when the model cannot be reached or rejects the request
     */
    String complete(String systemPrompt, String userPrompt, LlmOptions options);
}
