package com.contractdocs.rag.service;

import com.contractdocs.rag.config.RagProperties;
import com.contractdocs.rag.model.CollectionInfo;
import com.contractdocs.rag.model.CollectionRegistration;
import com.contractdocs.rag.model.CollectionStats;
import com.contractdocs.rag.model.RagAnswer;
import com.contractdocs.rag.model.RetrievalQuery;
import com.contractdocs.rag.model.RetrievalResult;
import com.contractdocs.rag.repository.StoreHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CollectionServiceImpl implements CollectionService {

    private final CollectionRegistry registry;
    private final VectorStoreAdapter vectorStore;
    private final RetrievalService retrievalService;
    private final StatsAggregator statsAggregator;
    private final CollectionInfoService infoService;
    private final RagChainBuilder chainBuilder;
    private final RagProperties properties;

    @Override
    public List<CollectionRegistration> listRegistered() {
        return registry.list();
    }

    @Override
    public List<CollectionStats> listAllStats() {
        return statsAggregator.listAll();
    }

    @Override
    public CollectionInfo describe(String collectionName) {
        return infoService.describe(collectionName);
    }

    @Override
    public RetrievalResult retrieve(String collectionName, String query, Optional<Integer> topK) {
        StoreHandle handle = openRegistered(collectionName);
        RetrievalQuery retrievalQuery = new RetrievalQuery(query, topK.orElse(properties.retrieval().topK()));
        return retrievalService.retrieve(handle, retrievalQuery);
    }

    @Override
    public RagChain chain(String collectionName, Optional<Integer> topK) {
        StoreHandle handle = openRegistered(collectionName);
        return topK
            .map(k -> chainBuilder.build(handle, k, properties.llm().apiKey(), properties.llm().model()))
            .orElseGet(() -> chainBuilder.build(handle));
    }

    @Override
    public RagAnswer ask(String collectionName, String question, Optional<Integer> topK) {
        return chain(collectionName, topK).ask(question);
    }

    private StoreHandle openRegistered(String collectionName) {
        registry.resolve(collectionName);
        StoreHandle handle = vectorStore.open(collectionName);
        log.debug("Opened collection {} at {}", collectionName, handle.location());
        return handle;
    }
}
