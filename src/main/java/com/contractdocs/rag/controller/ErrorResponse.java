package com.contractdocs.rag.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
