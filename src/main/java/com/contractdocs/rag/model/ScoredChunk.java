package com.contractdocs.rag.model;

public record ScoredChunk(
    Chunk chunk,
    double score
) {}
