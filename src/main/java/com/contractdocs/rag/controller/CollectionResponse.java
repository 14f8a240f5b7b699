package com.contractdocs.rag.controller;

import com.contractdocs.rag.model.CollectionRegistration;
import com.fasterxml.jackson.annotation.JsonProperty;

public record CollectionResponse(
    String name,
    @JsonProperty("source_document") String sourceDocument
) {
    public static CollectionResponse from(CollectionRegistration registration) {
        return new CollectionResponse(registration.name(), registration.sourceDocument());
    }
}
