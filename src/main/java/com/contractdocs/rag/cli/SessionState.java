package com.contractdocs.rag.cli;

public enum SessionState {
    AWAITING_MODE,
    AWAITING_COLLECTION,
    AWAITING_INPUT,
    EXECUTING,
    FINISHED
}
