package com.contractdocs.rag.repository;

import java.nio.file.Path;

/**
 * Live reference to one collection namespace inside the persisted store. Two
 * handles opened for the same name point at the same data.
 */
public record StoreHandle(
    String collectionName,
    Path location
) {}
