package com.contractdocs.rag.exception;

import lombok.Getter;

@Getter
public class GenerationFailedException extends RuntimeException {
    private final String modelName;

    public GenerationFailedException(String modelName, Throwable cause) {
        super("Answer generation with model '" + modelName + "' failed: " + cause.getMessage(), cause);
        this.modelName = modelName;
    }
}
