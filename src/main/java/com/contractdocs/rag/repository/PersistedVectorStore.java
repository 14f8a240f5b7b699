package com.contractdocs.rag.repository;

import com.contractdocs.rag.model.Chunk;
import com.contractdocs.rag.model.ScoredChunk;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Disk-backed vector store holding one namespace per collection. The store
 * embeds query text itself; callers only pass strings.
 */
public interface PersistedVectorStore {

    Path root();

    /**
     * Namespaces present under the root, in a stable order.
     */
    List<String> listNamespaces();

    /**
     * Binds a handle to the namespace. Never creates anything; a namespace the
     * store has not seen yields a handle over an empty collection.
     */
    StoreHandle open(String collectionName);

    long count(StoreHandle handle);

    /**
     * Metadata of at most {@code limit} chunks, read without loading the whole collection.
     */
    List<Map<String, Object>> peekMetadata(StoreHandle handle, int limit);

    Map<String, Object> collectionMetadata(StoreHandle handle);

    boolean supportsScoredSearch(StoreHandle handle);

    /**
     * Best match first. Only valid when {@link #supportsScoredSearch(StoreHandle)} holds.
     */
    List<ScoredChunk> similaritySearchWithScore(StoreHandle handle, String query, int k);

    List<Chunk> similaritySearch(StoreHandle handle, String query, int k);
}
