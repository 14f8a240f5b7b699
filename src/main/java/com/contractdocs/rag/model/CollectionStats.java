package com.contractdocs.rag.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record CollectionStats(
    String name,
    long count,
    Set<String> sampleSources,
    boolean degraded,
    String error
) {
    public CollectionStats {
        sampleSources = Collections.unmodifiableSet(new LinkedHashSet<>(sampleSources));
    }

    public static CollectionStats healthy(String name, long count, Set<String> sampleSources) {
        return new CollectionStats(name, count, sampleSources, false, null);
    }

    public static CollectionStats degraded(String name, String error) {
        return new CollectionStats(name, 0, Set.of(), true, error);
    }
}
