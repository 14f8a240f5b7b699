package com.contractdocs.rag.service;

import com.contractdocs.rag.config.RagProperties;
import com.contractdocs.rag.model.Chunk;
import com.contractdocs.rag.model.CollectionStats;
import com.contractdocs.rag.repository.StoreHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Statistics for every collection present in the store, including collections
 * the registry does not know about. A collection that fails inspection is
 * reported as degraded instead of failing the whole listing.
 */
@Slf4j
@Service
public class StatsAggregator {

    private final VectorStoreAdapter vectorStore;
    private final int sampleSize;

    @Autowired
    public StatsAggregator(VectorStoreAdapter vectorStore, RagProperties properties) {
        this(vectorStore, properties.store().sampleSize());
    }

    public StatsAggregator(VectorStoreAdapter vectorStore, int sampleSize) {
        this.vectorStore = vectorStore;
        this.sampleSize = sampleSize;
    }

    public List<CollectionStats> listAll() {
        List<String> namespaces = vectorStore.listNamespaces();
        log.debug("Inspecting {} collections under {}", namespaces.size(), vectorStore.persistDir());
        return namespaces.stream()
            .map(this::inspect)
            .toList();
    }

    private CollectionStats inspect(String name) {
        try {
            StoreHandle handle = vectorStore.open(name);
            long count = vectorStore.count(handle);
            Set<String> sources = new LinkedHashSet<>();
            for (Map<String, Object> metadata : vectorStore.sampleMetadata(handle, sampleSize)) {
                Object source = metadata.get(Chunk.SOURCE_KEY);
                if (source != null) {
                    sources.add(Objects.toString(source));
                }
            }
            return CollectionStats.healthy(name, count, sources);
        } catch (RuntimeException e) {
            log.warn("Collection {} could not be inspected: {}", name, e.getMessage());
            return CollectionStats.degraded(name, e.getMessage());
        }
    }
}
