package com.contractdocs.rag.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record AskRequest(
    @NotBlank String question,
    @JsonProperty("top_k") @Min(0) @Max(100) Integer topK
) {}
