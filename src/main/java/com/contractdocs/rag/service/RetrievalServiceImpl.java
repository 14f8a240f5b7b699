package com.contractdocs.rag.service;

import com.contractdocs.rag.exception.RetrievalFailedException;
import com.contractdocs.rag.model.RetrievalHit;
import com.contractdocs.rag.model.RetrievalQuery;
import com.contractdocs.rag.model.RetrievalResult;
import com.contractdocs.rag.model.ScoringMode;
import com.contractdocs.rag.repository.StoreHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalServiceImpl implements RetrievalService {

    private final VectorStoreAdapter vectorStore;

    @Override
    public RetrievalResult retrieve(StoreHandle handle, RetrievalQuery query) {
        int topK = Math.max(0, query.topK());
        String collection = handle.collectionName();

        if (topK == 0) {
            return RetrievalResult.empty(collection, query.text());
        }

        log.debug("Searching collection {} for top {}: {}", collection, topK, query.text());

        try {
            if (vectorStore.supportsScoredSearch(handle)) {
                List<RetrievalHit> hits = vectorStore.searchScored(handle, query.text(), topK).stream()
                    .limit(topK)
                    .map(RetrievalHit::scored)
                    .toList();
                return new RetrievalResult(collection, query.text(), topK, ScoringMode.SCORED, hits);
            }

            log.debug("Collection {} cannot score results, using unscored search", collection);
            List<RetrievalHit> hits = vectorStore.searchUnscored(handle, query.text(), topK).stream()
                .limit(topK)
                .map(RetrievalHit::unscored)
                .toList();
            return new RetrievalResult(collection, query.text(), topK, ScoringMode.UNSCORED, hits);

        } catch (RuntimeException e) {
            log.error("Similarity search failed for collection {} and query: {}", collection, query.text(), e);
            throw new RetrievalFailedException(collection, e);
        }
    }
}
