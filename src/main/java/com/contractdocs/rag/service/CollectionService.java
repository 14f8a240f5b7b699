package com.contractdocs.rag.service;

import com.contractdocs.rag.model.CollectionInfo;
import com.contractdocs.rag.model.CollectionRegistration;
import com.contractdocs.rag.model.CollectionStats;
import com.contractdocs.rag.model.RagAnswer;
import com.contractdocs.rag.model.RetrievalResult;

import java.util.List;
import java.util.Optional;

/**
 * Entry points used by the REST API and the console. Every per-collection
 * operation accepts registered names only.
 */
public interface CollectionService {

    List<CollectionRegistration> listRegistered();

    List<CollectionStats> listAllStats();

    CollectionInfo describe(String collectionName);

    RetrievalResult retrieve(String collectionName, String query, Optional<Integer> topK);

    /**
     * Builds the answering chain of a collection. Credentials and model name are
     * checked here, before any question is asked.
     */
    RagChain chain(String collectionName, Optional<Integer> topK);

    RagAnswer ask(String collectionName, String question, Optional<Integer> topK);
}
