package com.contractdocs.rag.service;

import com.contractdocs.rag.model.RetrievalQuery;
import com.contractdocs.rag.model.RetrievalResult;
import com.contractdocs.rag.repository.StoreHandle;

public interface RetrievalService {

    /**
     * Top-k similarity search. Falls back to unscored search when the store cannot
     * score; any other store failure surfaces as a
     * {@link com.contractdocs.rag.exception.RetrievalFailedException}.
     */
    RetrievalResult retrieve(StoreHandle handle, RetrievalQuery query);
}
