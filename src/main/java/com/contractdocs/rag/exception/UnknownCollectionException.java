package com.contractdocs.rag.exception;

import lombok.Getter;

@Getter
public class UnknownCollectionException extends RuntimeException {
    private final String collectionName;

    public UnknownCollectionException(String collectionName) {
        super("Unknown collection: '" + collectionName + "' is not registered");
        this.collectionName = collectionName;
    }
}
