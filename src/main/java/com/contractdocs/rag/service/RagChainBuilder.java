package com.contractdocs.rag.service;

import com.contractdocs.rag.config.RagProperties;
import com.contractdocs.rag.exception.InvalidConfigurationException;
import com.contractdocs.rag.exception.MissingCredentialException;
import com.contractdocs.rag.infra.ChatModelFactory;
import com.contractdocs.rag.infra.RateLimiter;
import com.contractdocs.rag.repository.StoreHandle;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class RagChainBuilder {

    static final String CREDENTIAL_NAME = "GROQ_API_KEY";

    private final RetrievalService retrievalService;
    private final ChatModelFactory chatModelFactory;
    private final RateLimiter generationLimiter;
    private final RagProperties properties;

    public RagChainBuilder(
        RetrievalService retrievalService,
        ChatModelFactory chatModelFactory,
        @Qualifier("generationLimiter") RateLimiter generationLimiter,
        RagProperties properties
    ) {
        this.retrievalService = retrievalService;
        this.chatModelFactory = chatModelFactory;
        this.generationLimiter = generationLimiter;
        this.properties = properties;
    }

    /**
     * Builds a chain with the configured top-k, credential and model.
     */
    public RagChain build(StoreHandle handle) {
        return build(handle, properties.retrieval().topK(), properties.llm().apiKey(), properties.llm().model());
    }

    /**
     * Credential and model name are validated before any client is created.
     *
     * @throws MissingCredentialException    when {@code apiKey} is null or blank
     * @throws InvalidConfigurationException when {@code modelName} is null or blank
     */
    public RagChain build(StoreHandle handle, int topK, String apiKey, String modelName) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new MissingCredentialException(CREDENTIAL_NAME);
        }
        if (modelName == null || modelName.isBlank()) {
            throw new InvalidConfigurationException("Cannot build RAG chain: model name is empty");
        }

        ChatModel chatModel = chatModelFactory.create(apiKey, modelName);
        CollectionContentRetriever retriever = new CollectionContentRetriever(retrievalService, handle, topK);
        log.info("Built RAG chain for collection {} (top {}, model {})", handle.collectionName(), retriever.topK(), modelName);

        return new RagChain(retriever, chatModel, modelName, generationLimiter);
    }
}
