package com.contractdocs.rag.model;

public record RetrievalQuery(
    String text,
    int topK
) {
    public RetrievalQuery {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Query cannot be blank");
        }
    }
}
