package com.contractdocs.rag.model;

/**
 * A chunk returned by a similarity search together with its relevance score.
 * The score is {@code null} when the store could not produce one.
 */
public record RetrievalHit(
    Chunk chunk,
    Double score
) {
    public static RetrievalHit scored(ScoredChunk scoredChunk) {
        return new RetrievalHit(scoredChunk.chunk(), scoredChunk.score());
    }

    public static RetrievalHit unscored(Chunk chunk) {
        return new RetrievalHit(chunk, null);
    }

    public boolean hasScore() {
        return score != null;
    }
}
