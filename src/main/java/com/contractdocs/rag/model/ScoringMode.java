package com.contractdocs.rag.model;

public enum ScoringMode {
    SCORED,
    UNSCORED
}
