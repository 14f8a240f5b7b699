package com.contractdocs.rag.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One embedded span of document text as stored in a collection. The embedding
 * vector stays inside the persisted store and is not carried here.
 */
public record Chunk(
    String id,
    String content,
    Map<String, Object> metadata
) {
    public static final String SOURCE_KEY = "source";

    public Chunk {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String source() {
        Object source = metadata.get(SOURCE_KEY);
        return source == null ? null : source.toString();
    }
}
