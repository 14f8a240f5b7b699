package com.contractdocs.rag.cli;

import com.contractdocs.rag.model.CollectionRegistration;
import com.contractdocs.rag.service.CollectionService;
import com.contractdocs.rag.service.RagChain;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Console dialogue as a state machine. It consumes one input line at a time and
 * returns the lines to display; reading and printing is left to the caller.
 * <pre>
 * AWAITING_MODE -> AWAITING_COLLECTION -> [AWAITING_INPUT] -> EXECUTING -> AWAITING_MODE
 * </pre>
 * Listing collections runs straight from AWAITING_MODE, quitting ends in FINISHED.
 */
@Slf4j
public class InteractiveSession {

    private final CollectionService collectionService;
    private final ResultFormatter formatter;

    private SessionState state = SessionState.AWAITING_MODE;
    private Command pending;
    private CollectionRegistration selected;
    private RagChain chain;
    private List<CollectionRegistration> choices = List.of();

    public InteractiveSession(CollectionService collectionService, ResultFormatter formatter) {
        this.collectionService = collectionService;
        this.formatter = formatter;
    }

    public SessionState state() {
        return state;
    }

    public boolean isFinished() {
        return state == SessionState.FINISHED;
    }

    public List<String> start() {
        return modeMenu();
    }

    public String prompt() {
        return switch (state) {
            case AWAITING_MODE -> "Choose mode: ";
            case AWAITING_COLLECTION -> "Select collection (1-" + choices.size() + "): ";
            case AWAITING_INPUT -> pending == Command.ASK_RAG ? "Enter your RAG question: " : "Enter your query: ";
            case EXECUTING, FINISHED -> "";
        };
    }

    public List<String> handle(String input) {
        return switch (state) {
            case AWAITING_MODE -> onMode(input);
            case AWAITING_COLLECTION -> onCollection(input);
            case AWAITING_INPUT -> onInput(input);
            case EXECUTING, FINISHED -> List.of();
        };
    }

    private List<String> onMode(String input) {
        Optional<Command> command = Command.fromKey(input);
        if (command.isEmpty()) {
            String keys = Arrays.stream(Command.values()).map(Command::key).collect(Collectors.joining(", "));
            return List.of("Invalid choice. Please select " + keys + ".");
        }

        Command selectedCommand = command.get();
        if (selectedCommand == Command.QUIT) {
            state = SessionState.FINISHED;
            return List.of("Exiting.");
        }
        if (selectedCommand == Command.LIST_COLLECTIONS) {
            List<String> output = new ArrayList<>(execute(selectedCommand,
                () -> formatter.formatStats(collectionService.listAllStats())));
            output.addAll(modeMenu());
            return output;
        }
        return selectCollection(selectedCommand);
    }

    private List<String> selectCollection(Command command) {
        choices = collectionService.listRegistered();
        if (choices.isEmpty()) {
            List<String> output = new ArrayList<>(List.of("No collections registered."));
            output.addAll(modeMenu());
            return output;
        }
        pending = command;
        state = SessionState.AWAITING_COLLECTION;

        List<String> output = new ArrayList<>();
        output.add("Available collections:");
        for (int i = 0; i < choices.size(); i++) {
            CollectionRegistration registration = choices.get(i);
            String document = registration.sourceDocument() == null ? "" : " (" + registration.sourceDocument() + ")";
            output.add((i + 1) + ". " + registration.name() + document);
        }
        return output;
    }

    private List<String> onCollection(String input) {
        int choice;
        try {
            choice = Integer.parseInt(input == null ? "" : input.trim());
        } catch (NumberFormatException e) {
            return List.of("Please enter a number.");
        }
        if (choice < 1 || choice > choices.size()) {
            return List.of("Invalid choice. Please select a number between 1 and " + choices.size() + ".");
        }
        selected = choices.get(choice - 1);

        if (pending == Command.SHOW_INFO) {
            return finish(execute(pending, () -> formatter.formatInfo(collectionService.describe(selected.name()))));
        }
        if (pending == Command.ASK_RAG) {
            try {
                chain = collectionService.chain(selected.name(), Optional.empty());
            } catch (RuntimeException e) {
                log.warn("{} unavailable for {}: {}", pending, selected.name(), e.getMessage());
                return finish(List.of("Error: " + e.getMessage()));
            }
        }
        state = SessionState.AWAITING_INPUT;
        return List.of();
    }

    private List<String> onInput(String input) {
        if (input == null || input.isBlank()) {
            return finish(List.of("No query provided. Continuing."));
        }
        String text = input.trim();
        if (pending == Command.ASK_RAG) {
            return finish(execute(pending, () -> formatter.formatAnswer(chain.ask(text))));
        }
        return finish(execute(pending, () ->
            formatter.formatRetrieval(collectionService.retrieve(selected.name(), text, Optional.empty()))));
    }

    private List<String> execute(Command command, Supplier<List<String>> action) {
        state = SessionState.EXECUTING;
        try {
            return action.get();
        } catch (RuntimeException e) {
            log.warn("{} failed: {}", command, e.getMessage());
            return List.of("Error: " + e.getMessage());
        } finally {
            state = SessionState.AWAITING_MODE;
        }
    }

    private List<String> finish(List<String> output) {
        pending = null;
        selected = null;
        chain = null;
        state = SessionState.AWAITING_MODE;
        List<String> lines = new ArrayList<>(output);
        lines.addAll(modeMenu());
        return lines;
    }

    private List<String> modeMenu() {
        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.add("Choose mode:");
        for (Command command : Command.values()) {
            lines.add(" " + command.key() + ". " + command.label());
        }
        return lines;
    }
}
