package com.contractdocs.rag.infra;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Builds {@link OpenAiChatModel} clients against any OpenAI compatible endpoint,
 * Groq by default. Retries are disabled: a failed call is reported once.
 */
@Slf4j
@RequiredArgsConstructor
public class OpenAiCompatibleChatModelFactory implements ChatModelFactory {

    private final String baseUrl;
    private final Duration timeout;

    @Override
    public ChatModel create(String apiKey, String modelName) {
        log.info("Creating chat model client {} via {}", modelName, baseUrl);
        return OpenAiChatModel.builder()
            .apiKey(apiKey)
            .baseUrl(baseUrl)
            .modelName(modelName)
            .timeout(timeout)
            .maxRetries(0)
            .build();
    }
}
