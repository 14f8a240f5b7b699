package com.contractdocs.rag.cli;

import com.contractdocs.rag.model.CollectionInfo;
import com.contractdocs.rag.model.CollectionStats;
import com.contractdocs.rag.model.RagAnswer;
import com.contractdocs.rag.model.RetrievalResult;

import java.util.List;

/**
 * Renders core results as display lines.
 */
public interface ResultFormatter {

    List<String> formatRetrieval(RetrievalResult result);

    List<String> formatStats(List<CollectionStats> stats);

    List<String> formatInfo(CollectionInfo info);

    List<String> formatAnswer(RagAnswer answer);
}
