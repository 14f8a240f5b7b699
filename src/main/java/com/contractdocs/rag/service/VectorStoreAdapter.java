package com.contractdocs.rag.service;

import com.contractdocs.rag.exception.StoreUnavailableException;
import com.contractdocs.rag.model.Chunk;
import com.contractdocs.rag.model.ScoredChunk;
import com.contractdocs.rag.repository.PersistedVectorStore;
import com.contractdocs.rag.repository.StoreHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Opens collections of the shared persisted store. The store root is checked
 * when the adapter is created, so a missing root stops the application before
 * any request is served.
 */
@Slf4j
@Service
public class VectorStoreAdapter {

    private final PersistedVectorStore store;

    public VectorStoreAdapter(PersistedVectorStore store) {
        this.store = store;
        checkRoot();
        log.info("Using vector store at {}", store.root());
    }

    public StoreHandle open(String collectionName) {
        checkRoot();
        return store.open(collectionName);
    }

    public long count(StoreHandle handle) {
        return store.count(handle);
    }

    public List<Map<String, Object>> sampleMetadata(StoreHandle handle, int limit) {
        return store.peekMetadata(handle, limit);
    }

    public Map<String, Object> collectionMetadata(StoreHandle handle) {
        return store.collectionMetadata(handle);
    }

    public boolean supportsScoredSearch(StoreHandle handle) {
        return store.supportsScoredSearch(handle);
    }

    public List<ScoredChunk> searchScored(StoreHandle handle, String query, int topK) {
        return store.similaritySearchWithScore(handle, query, topK);
    }

    public List<Chunk> searchUnscored(StoreHandle handle, String query, int topK) {
        return store.similaritySearch(handle, query, topK);
    }

    public List<String> listNamespaces() {
        checkRoot();
        return store.listNamespaces();
    }

    public Path persistDir() {
        return store.root();
    }

    /**
     * Total size of all files under the store root. The store is shared, so this is
     * not a per-collection figure. Files that vanish or cannot be read are skipped.
     */
    public long storeSizeBytes() {
        try (Stream<Path> files = Files.walk(store.root())) {
            return files.filter(Files::isRegularFile)
                .mapToLong(this::sizeOf)
                .sum();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot compute size of " + store.root(), e);
        }
    }

    private long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
            return 0;
        }
    }

    private void checkRoot() {
        Path root = store.root();
        if (!Files.isDirectory(root)) {
            throw new StoreUnavailableException(root, "directory not found");
        }
        if (!Files.isReadable(root)) {
            throw new StoreUnavailableException(root, "directory not readable");
        }
    }
}
