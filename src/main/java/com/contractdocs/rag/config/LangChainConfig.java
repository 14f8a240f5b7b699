package com.contractdocs.rag.config;

import com.contractdocs.rag.exception.InvalidConfigurationException;
import com.contractdocs.rag.infra.ChatModelFactory;
import com.contractdocs.rag.infra.OpenAiCompatibleChatModelFactory;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;
import java.util.Set;

@Slf4j
@Configuration
public class LangChainConfig {

    static final String OPENAI_PREFIX = "openai/";

    private static final Set<String> MINILM_IDENTIFIERS = Set.of(
        "sentence-transformers/all-minilm-l6-v2",
        "all-minilm-l6-v2"
    );

    /**
     * Process-wide embedding function shared by every collection handle.
     */
    @Bean
    public EmbeddingModel embeddingModel(RagProperties properties) {
        RagProperties.Embedding embedding = properties.embedding();
        String identifier = embedding.model().trim();

        if (MINILM_IDENTIFIERS.contains(identifier.toLowerCase(Locale.ROOT))) {
            log.info("Loading in-process embedding model {}", identifier);
            return new AllMiniLmL6V2EmbeddingModel();
        }

        if (identifier.startsWith(OPENAI_PREFIX)) {
            String modelName = identifier.substring(OPENAI_PREFIX.length());
            if (modelName.isBlank() || embedding.apiKey() == null || embedding.apiKey().isBlank()) {
                throw new InvalidConfigurationException(
                    "Embedding model '" + identifier + "' requires a model name and app.embedding.api-key");
            }
            log.info("Using remote embedding model {} via {}", modelName, embedding.baseUrl());
            return OpenAiEmbeddingModel.builder()
                .apiKey(embedding.apiKey())
                .baseUrl(embedding.baseUrl())
                .modelName(modelName)
                .build();
        }

        throw new InvalidConfigurationException("Unsupported embedding model identifier: " + identifier);
    }

    @Bean
    public ChatModelFactory chatModelFactory(RagProperties properties) {
        return new OpenAiCompatibleChatModelFactory(properties.llm().baseUrl(), properties.llm().timeout());
    }
}
