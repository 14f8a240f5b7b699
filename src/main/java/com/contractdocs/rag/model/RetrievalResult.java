package com.contractdocs.rag.model;

import java.util.List;

/**
 * Hits in the order the store returned them, best first. In {@link ScoringMode#UNSCORED}
 * mode none of the hits carries a score.
 */
public record RetrievalResult(
    String collectionName,
    String query,
    int topK,
    ScoringMode scoring,
    List<RetrievalHit> hits
) {
    public RetrievalResult {
        hits = List.copyOf(hits);
    }

    public static RetrievalResult empty(String collectionName, String query) {
        return new RetrievalResult(collectionName, query, 0, ScoringMode.SCORED, List.of());
    }

    public int size() {
        return hits.size();
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }
}
