package com.contractdocs.rag.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class StoreUnavailableException extends RuntimeException {
    private final Path persistDir;

    public StoreUnavailableException(Path persistDir, String reason) {
        super("Vector store unavailable at " + persistDir + ": " + reason);
        this.persistDir = persistDir;
    }
}
