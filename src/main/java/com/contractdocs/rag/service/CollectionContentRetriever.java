package com.contractdocs.rag.service;

import com.contractdocs.rag.model.Chunk;
import com.contractdocs.rag.model.RetrievalHit;
import com.contractdocs.rag.model.RetrievalQuery;
import com.contractdocs.rag.model.RetrievalResult;
import com.contractdocs.rag.repository.StoreHandle;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.rag.content.Content;
import dev.langchain4j.rag.content.retriever.ContentRetriever;
import dev.langchain4j.rag.query.Query;

import java.util.List;

/**
 * {@link ContentRetriever} over one collection, bound to a fixed top-k. Each call
 * performs a single retrieval through {@link RetrievalService}; chunks without
 * text are left out of the context.
 */
public class CollectionContentRetriever implements ContentRetriever {

    private final RetrievalService retrievalService;
    private final StoreHandle handle;
    private final int topK;

    public CollectionContentRetriever(RetrievalService retrievalService, StoreHandle handle, int topK) {
        this.retrievalService = retrievalService;
        this.handle = handle;
        this.topK = Math.max(0, topK);
    }

    @Override
    public List<Content> retrieve(Query query) {
        RetrievalResult result = retrievalService.retrieve(handle, new RetrievalQuery(query.text(), topK));
        return result.hits().stream()
            .map(RetrievalHit::chunk)
            .filter(chunk -> chunk.content() != null && !chunk.content().isBlank())
            .map(CollectionContentRetriever::toContent)
            .toList();
    }

    public int topK() {
        return topK;
    }

    private static Content toContent(Chunk chunk) {
        Metadata metadata = new Metadata();
        String source = chunk.source();
        if (source != null) {
            metadata.put(Chunk.SOURCE_KEY, source);
        }
        return Content.from(TextSegment.from(chunk.content(), metadata));
    }
}
