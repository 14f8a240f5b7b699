package com.contractdocs.rag.controller;

import com.contractdocs.rag.model.RetrievalResult;
import com.contractdocs.rag.model.ScoringMode;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.stream.IntStream;

public record SearchResponse(
    String collection,
    String query,
    @JsonProperty("top_k") int topK,
    ScoringMode scoring,
    List<SearchResultItem> results
) {
    public static SearchResponse from(RetrievalResult result) {
        List<SearchResultItem> items = IntStream.range(0, result.size())
            .mapToObj(i -> SearchResultItem.from(i + 1, result.hits().get(i)))
            .toList();
        return new SearchResponse(result.collectionName(), result.query(), result.topK(), result.scoring(), items);
    }
}
