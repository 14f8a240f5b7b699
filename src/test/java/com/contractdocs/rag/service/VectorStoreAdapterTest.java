package com.contractdocs.rag.service;

import com.contractdocs.rag.exception.StoreUnavailableException;
import com.contractdocs.rag.repository.JsonLinesVectorStore;
import com.contractdocs.rag.repository.StoreHandle;
import com.contractdocs.rag.support.CollectionFixtures;
import com.contractdocs.rag.support.HashingEmbeddingModel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VectorStoreAdapterTest {

    @TempDir
    Path tempDir;

    private final HashingEmbeddingModel embeddingModel = new HashingEmbeddingModel();

    private JsonLinesVectorStore storeAt(Path root) {
        return new JsonLinesVectorStore(root, embeddingModel, new ObjectMapper());
    }

    @Test
    @DisplayName("Should refuse to start when the store root does not exist")
    void shouldFailFastOnMissingRoot() {
        Path missing = tempDir.resolve("no-such-store");

        assertThatThrownBy(() -> new VectorStoreAdapter(storeAt(missing)))
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessageContaining("no-such-store")
            .hasMessageContaining("directory not found");
    }

    @Test
    @DisplayName("Should refuse a store root that is a regular file")
    void shouldFailOnFileRoot() throws IOException {
        Path file = Files.writeString(tempDir.resolve("store.db"), "not a directory");

        assertThatThrownBy(() -> new VectorStoreAdapter(storeAt(file)))
            .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    @DisplayName("Should report StoreUnavailable when the root disappears after startup")
    void shouldFailOpenWhenRootRemoved() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("store"));
        VectorStoreAdapter adapter = new VectorStoreAdapter(storeAt(root));
        Files.delete(root);

        assertThatThrownBy(() -> adapter.open("Sample"))
            .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void shouldOpenCollectionNotYetCreatedWithCountZero() {
        VectorStoreAdapter adapter = new VectorStoreAdapter(storeAt(tempDir));

        StoreHandle handle = adapter.open("Pending_Ingestion");

        assertThat(adapter.count(handle)).isZero();
        assertThat(adapter.listNamespaces()).isEmpty();
    }

    @Test
    void shouldExposeCountSampleAndStoreSize() throws IOException {
        new CollectionFixtures(tempDir, embeddingModel)
            .writeCollection("Sample", List.of("alpha", "beta", "gamma"), "sample.pdf");
        VectorStoreAdapter adapter = new VectorStoreAdapter(storeAt(tempDir));

        StoreHandle handle = adapter.open("Sample");

        assertThat(adapter.count(handle)).isEqualTo(3);
        assertThat(adapter.sampleMetadata(handle, 2)).hasSize(2);
        assertThat(adapter.storeSizeBytes())
            .isEqualTo(Files.size(tempDir.resolve("Sample").resolve("chunks.jsonl")));
        assertThat(adapter.persistDir()).isEqualTo(tempDir);
    }
}
