package com.contractdocs.rag.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * One line of a collection's {@code chunks.jsonl} file as written by ingestion.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record StoredChunk(
    String id,
    String text,
    Map<String, Object> metadata,
    float[] embedding
) {}
