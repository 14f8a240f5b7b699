package com.contractdocs.rag.exception;

import lombok.Getter;

@Getter
public class RetrievalFailedException extends RuntimeException {
    private final String collectionName;

    public RetrievalFailedException(String collectionName, Throwable cause) {
        super("Retrieval from collection '" + collectionName + "' failed: " + cause.getMessage(), cause);
        this.collectionName = collectionName;
    }
}
