package com.contractdocs.rag.controller;

import com.contractdocs.rag.model.RetrievalHit;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResultItem(
    int rank,
    String id,
    String content,
    String source,
    Double score,
    Map<String, Object> metadata
) {
    public static SearchResultItem from(int rank, RetrievalHit hit) {
        return new SearchResultItem(
            rank,
            hit.chunk().id(),
            hit.chunk().content(),
            hit.chunk().source(),
            hit.score(),
            hit.chunk().metadata()
        );
    }
}
