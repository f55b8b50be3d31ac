package com.eainde.loganalyzer.llm;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link LlmTransport} backed by a LangChain4j {@link ChatModel}.
 */
@Slf4j
public class ChatModelTransport implements LlmTransport {

    private final ChatModel chatModel;

    public ChatModelTransport(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, LlmOptions options) {
        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt))
                .parameters(ChatRequestParameters.builder()
                        .modelName(options.model())
                        .temperature(options.temperature())
                        .build())
                .build();

        ChatResponse response = chatModel.chat(request);
        if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
            log.warn("Model {} returned no text content", options.model());
            return "";
        }
        return response.aiMessage().text();
    }
}
