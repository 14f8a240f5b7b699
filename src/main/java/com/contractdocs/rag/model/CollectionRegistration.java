package com.contractdocs.rag.model;

import jakarta.validation.constraints.NotBlank;

public record CollectionRegistration(
    @NotBlank String name,
    String sourceDocument
) {}
