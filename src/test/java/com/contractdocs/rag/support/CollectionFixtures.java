package com.contractdocs.rag.support;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes collections in the on-disk layout the ingestion pipeline produces.
 */
public class CollectionFixtures {

    private final Path root;
    private final HashingEmbeddingModel embeddingModel;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public CollectionFixtures(Path root, HashingEmbeddingModel embeddingModel) {
        this.root = root;
        this.embeddingModel = embeddingModel;
    }

    public Path writeCollection(String name, List<String> texts, String source) throws IOException {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (source != null) {
                metadata.put("source", source);
            }
            metadata.put("page", i / 3 + 1);
            lines.add(chunkLine(name + "-" + i, texts.get(i), metadata));
        }
        Path dir = Files.createDirectories(root.resolve(name));
        return Files.write(dir.resolve("chunks.jsonl"), lines);
    }

    public void appendChunk(String name, String id, String text, Map<String, Object> metadata) throws IOException {
        Files.write(root.resolve(name).resolve("chunks.jsonl"), List.of(chunkLine(id, text, metadata)),
            StandardOpenOption.APPEND);
    }

    public void writeRawChunks(String name, List<String> lines) throws IOException {
        Path dir = Files.createDirectories(root.resolve(name));
        Files.write(dir.resolve("chunks.jsonl"), lines);
    }

    public void writeDescriptor(String name, Map<String, Object> metadata) throws IOException {
        Path dir = Files.createDirectories(root.resolve(name));
        objectMapper.writeValue(dir.resolve("collection.json").toFile(), Map.of("metadata", metadata));
    }

    public String chunkLine(String id, String text, Map<String, Object> metadata) throws IOException {
        Map<String, Object> chunk = new LinkedHashMap<>();
        chunk.put("id", id);
        chunk.put("text", text);
        chunk.put("metadata", metadata);
        chunk.put("embedding", embeddingModel.vector(text));
        return objectMapper.writeValueAsString(chunk);
    }
}
