package com.contractdocs.rag.model;

import java.util.List;

public record RagAnswer(
    String question,
    String answer,
    List<String> sources
) {}
