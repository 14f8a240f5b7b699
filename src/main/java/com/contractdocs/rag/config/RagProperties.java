package com.contractdocs.rag.config;

import com.contractdocs.rag.model.CollectionRegistration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app")
public record RagProperties(
    @Valid @NotNull Store store,
    @Valid @NotNull @DefaultValue Embedding embedding,
    @Valid @NotNull @DefaultValue Retrieval retrieval,
    @Valid @NotNull @DefaultValue Llm llm,
    @Valid @DefaultValue List<CollectionRegistration> collections
) {

    public record Store(
        @NotBlank String persistDir,
        @DefaultValue("20") @Min(1) @Max(1000) Integer sampleSize
    ) {
        public Path resolvedPersistDir() {
            String dir = persistDir.trim();
            if (dir.equals("~") || dir.startsWith("~/")) {
                dir = System.getProperty("user.home") + dir.substring(1);
            }
            return Path.of(dir).toAbsolutePath().normalize();
        }
    }

    public record Embedding(
        @DefaultValue("sentence-transformers/all-MiniLM-L6-v2") @NotBlank String model,
        String apiKey,
        @DefaultValue("https://api.openai.com/v1") String baseUrl
    ) {}

    public record Retrieval(
        @DefaultValue("5") @NotNull @Min(0) @Max(100) Integer topK
    ) {}

    /**
     * Hosted chat model reached through an OpenAI compatible endpoint. The API key
     * may be empty; RAG chain construction reports it as a missing credential.
     */
    public record Llm(
        String apiKey,
        @DefaultValue("llama-3.1-8b-instant") String model,
        @DefaultValue("https://api.groq.com/openai/v1") String baseUrl,
        @DefaultValue("60s") Duration timeout,
        @DefaultValue("30") @Min(1) Integer requestsPerMinute
    ) {}
}
