package com.contractdocs.rag.model;

import java.util.Map;

public record CollectionInfo(
    String name,
    String sourceDocument,
    long count,
    long storeSizeBytes,
    String embeddingModel,
    String persistDir,
    Map<String, Object> collectionMetadata
) {}
