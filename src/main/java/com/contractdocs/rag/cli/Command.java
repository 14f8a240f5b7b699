package com.contractdocs.rag.cli;

import java.util.Arrays;
import java.util.Optional;

public enum Command {
    LIST_COLLECTIONS("1", "List collections"),
    SHOW_INFO("2", "Display info"),
    RETRIEVE("3", "Retrieve"),
    ASK_RAG("4", "RAG"),
    QUIT("5", "Quit");

    private final String key;
    private final String label;

    Command(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public boolean needsCollection() {
        return this == SHOW_INFO || this == RETRIEVE || this == ASK_RAG;
    }

    public static Optional<Command> fromKey(String input) {
        String trimmed = input == null ? "" : input.trim();
        return Arrays.stream(values())
            .filter(command -> command.key.equals(trimmed))
            .findFirst();
    }
}
