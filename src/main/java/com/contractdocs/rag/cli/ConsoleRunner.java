package com.contractdocs.rag.cli;

import com.contractdocs.rag.service.CollectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Interactive console over {@link InteractiveSession}; active with the {@code cli} profile.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.cli.enabled", havingValue = "true")
public class ConsoleRunner implements CommandLineRunner {

    private final CollectionService collectionService;
    private final ResultFormatter formatter;

    @Override
    public void run(String... args) throws Exception {
        InteractiveSession session = new InteractiveSession(collectionService, formatter);
        PrintStream out = System.out;
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        print(out, session.start());
        while (!session.isFinished()) {
            out.print(session.prompt());
            out.flush();
            String line = in.readLine();
            if (line == null) {
                log.debug("Console input closed, ending session");
                break;
            }
            print(out, session.handle(line));
        }
    }

    private static void print(PrintStream out, List<String> lines) {
        lines.forEach(out::println);
    }
}
