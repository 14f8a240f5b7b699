package com.contractdocs.rag.exception;

public class MissingCredentialException extends RuntimeException {

    public MissingCredentialException(String credentialName) {
        super("Cannot build RAG chain: " + credentialName + " is not set");
    }
}
