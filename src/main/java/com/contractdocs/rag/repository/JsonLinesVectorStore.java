package com.contractdocs.rag.repository;

import com.contractdocs.rag.config.RagProperties;
import com.contractdocs.rag.model.Chunk;
import com.contractdocs.rag.model.ScoredChunk;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * File-backed store: every collection is a directory under the root holding a
 * {@code chunks.jsonl} file (one chunk per line with its embedding) and an
 * optional {@code collection.json} with collection-level metadata.
 * <p>
 * Counting and metadata peeks stream the chunk file. Searches load the
 * collection into an {@link InMemoryEmbeddingStore}, cached until the chunk
 * file changes on disk.
 */
@Slf4j
@Repository
public class JsonLinesVectorStore implements PersistedVectorStore {

    static final String CHUNKS_FILE = "chunks.jsonl";
    static final String COLLECTION_FILE = "collection.json";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final Path root;
    private final EmbeddingModel embeddingModel;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<Path, LoadedCollection> loaded = new ConcurrentHashMap<>();

    @Autowired
    public JsonLinesVectorStore(RagProperties properties, EmbeddingModel embeddingModel, ObjectMapper objectMapper) {
        this(properties.store().resolvedPersistDir(), embeddingModel, objectMapper);
    }

    public JsonLinesVectorStore(Path root, EmbeddingModel embeddingModel, ObjectMapper objectMapper) {
        this.root = root;
        this.embeddingModel = embeddingModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public List<String> listNamespaces() {
        try (Stream<Path> entries = Files.list(root)) {
            return entries
                .filter(Files::isDirectory)
                .filter(dir -> Files.exists(dir.resolve(CHUNKS_FILE)) || Files.exists(dir.resolve(COLLECTION_FILE)))
                .map(dir -> dir.getFileName().toString())
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list collections under " + root, e);
        }
    }

    @Override
    public StoreHandle open(String collectionName) {
        if (collectionName == null || collectionName.isBlank()) {
            throw new IllegalArgumentException("Collection name cannot be blank");
        }
        Path location = root.resolve(collectionName).normalize();
        if (!root.normalize().equals(location.getParent())) {
            throw new IllegalArgumentException("Invalid collection name: " + collectionName);
        }
        return new StoreHandle(collectionName, location);
    }

    @Override
    public long count(StoreHandle handle) {
        Path chunks = handle.location().resolve(CHUNKS_FILE);
        if (!Files.exists(chunks)) {
            return 0;
        }
        try (Stream<String> lines = Files.lines(chunks)) {
            return lines.filter(line -> !line.isBlank()).count();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot count chunks of collection " + handle.collectionName(), e);
        }
    }

    @Override
    public List<Map<String, Object>> peekMetadata(StoreHandle handle, int limit) {
        Path chunks = handle.location().resolve(CHUNKS_FILE);
        if (limit <= 0 || !Files.exists(chunks)) {
            return List.of();
        }

        List<Map<String, Object>> sample = new ArrayList<>(limit);
        try (BufferedReader reader = Files.newBufferedReader(chunks)) {
            String line;
            while (sample.size() < limit && (line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                JsonNode metadata = objectMapper.readTree(line).path("metadata");
                sample.add(metadata.isObject() ? objectMapper.convertValue(metadata, METADATA_TYPE) : Map.of());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read chunk metadata of collection " + handle.collectionName(), e);
        }
        return sample;
    }

    @Override
    public Map<String, Object> collectionMetadata(StoreHandle handle) {
        Path descriptor = handle.location().resolve(COLLECTION_FILE);
        if (!Files.exists(descriptor)) {
            return Map.of();
        }
        try {
            JsonNode metadata = objectMapper.readTree(descriptor.toFile()).path("metadata");
            return metadata.isObject() ? objectMapper.convertValue(metadata, METADATA_TYPE) : Map.of();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read descriptor of collection " + handle.collectionName(), e);
        }
    }

    @Override
    public boolean supportsScoredSearch(StoreHandle handle) {
        return true;
    }

    @Override
    public List<ScoredChunk> similaritySearchWithScore(StoreHandle handle, String query, int k) {
        if (k <= 0) {
            return List.of();
        }
        LoadedCollection collection = load(handle);
        if (collection.isEmpty()) {
            return List.of();
        }

        Embedding queryEmbedding = embeddingModel.embed(query).content();
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(k)
            .minScore(0.0)
            .build();

        List<EmbeddingMatch<TextSegment>> matches = collection.index().search(request).matches();
        log.debug("Collection {}: {} matches for k={}", handle.collectionName(), matches.size(), k);

        return matches.stream()
            .map(match -> new ScoredChunk(collection.chunksByKey().get(match.embeddingId()), match.score()))
            .toList();
    }

    @Override
    public List<Chunk> similaritySearch(StoreHandle handle, String query, int k) {
        return similaritySearchWithScore(handle, query, k).stream()
            .map(ScoredChunk::chunk)
            .toList();
    }

    private LoadedCollection load(StoreHandle handle) {
        Path chunks = handle.location().resolve(CHUNKS_FILE);
        if (!Files.exists(chunks)) {
            loaded.remove(chunks);
            return LoadedCollection.EMPTY;
        }
        try {
            BasicFileAttributes attributes = Files.readAttributes(chunks, BasicFileAttributes.class);
            LoadedCollection cached = loaded.get(chunks);
            if (cached != null && cached.isCurrent(attributes)) {
                return cached;
            }
            LoadedCollection fresh = read(handle, chunks, attributes);
            loaded.put(chunks, fresh);
            return fresh;
        } catch (NoSuchFileException e) {
            loaded.remove(chunks);
            return LoadedCollection.EMPTY;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load collection " + handle.collectionName(), e);
        }
    }

    boolean isLoaded(StoreHandle handle) {
        return loaded.containsKey(handle.location().resolve(CHUNKS_FILE));
    }

    private LoadedCollection read(StoreHandle handle, Path chunks, BasicFileAttributes attributes) {
        InMemoryEmbeddingStore<TextSegment> index = new InMemoryEmbeddingStore<>();
        Map<String, Chunk> chunksByKey = new HashMap<>();

        try (BufferedReader reader = Files.newBufferedReader(chunks)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                StoredChunk stored = objectMapper.readValue(line, StoredChunk.class);
                if (stored.embedding() == null || stored.embedding().length == 0) {
                    throw new IllegalStateException(
                        "Chunk on line " + lineNumber + " of collection " + handle.collectionName() + " has no embedding");
                }
                // keyed by line, stored ids are not guaranteed unique
                String key = Integer.toString(lineNumber);
                String id = stored.id() != null ? stored.id() : handle.collectionName() + "-" + lineNumber;
                index.add(key, Embedding.from(stored.embedding()));
                chunksByKey.put(key, new Chunk(id, stored.text() == null ? "" : stored.text(), stored.metadata()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read chunks of collection " + handle.collectionName(), e);
        }

        log.info("Loaded {} chunks of collection {}", chunksByKey.size(), handle.collectionName());
        return new LoadedCollection(index, chunksByKey, attributes.lastModifiedTime(), attributes.size());
    }

    private record LoadedCollection(
        InMemoryEmbeddingStore<TextSegment> index,
        Map<String, Chunk> chunksByKey,
        FileTime lastModified,
        long size
    ) {
        static final LoadedCollection EMPTY = new LoadedCollection(new InMemoryEmbeddingStore<>(), Map.of(), null, 0);

        boolean isEmpty() {
            return chunksByKey.isEmpty();
        }

        boolean isCurrent(BasicFileAttributes attributes) {
            return attributes.lastModifiedTime().equals(lastModified) && attributes.size() == size;
        }
    }
}
