package com.contractdocs.rag.service;

import com.contractdocs.rag.config.RagProperties;
import com.contractdocs.rag.model.CollectionInfo;
import com.contractdocs.rag.repository.StoreHandle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CollectionInfoService {

    private final CollectionRegistry registry;
    private final VectorStoreAdapter vectorStore;
    private final RagProperties properties;

    public CollectionInfo describe(String collectionName) {
        String sourceDocument = registry.resolve(collectionName).orElse(null);
        StoreHandle handle = vectorStore.open(collectionName);

        return new CollectionInfo(
            collectionName,
            sourceDocument,
            vectorStore.count(handle),
            vectorStore.storeSizeBytes(),
            properties.embedding().model(),
            vectorStore.persistDir().toString(),
            vectorStore.collectionMetadata(handle)
        );
    }
}
