package com.contractdocs.rag.cli;

import com.contractdocs.rag.model.CollectionInfo;
import com.contractdocs.rag.model.CollectionStats;
import com.contractdocs.rag.model.RagAnswer;
import com.contractdocs.rag.model.RetrievalHit;
import com.contractdocs.rag.model.RetrievalResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class ConsoleResultFormatter implements ResultFormatter {

    static final int SNIPPET_LENGTH = 800;

    private static final long MEGABYTE = 1024 * 1024;

    @Override
    public List<String> formatRetrieval(RetrievalResult result) {
        List<String> lines = new ArrayList<>();
        if (result.isEmpty()) {
            lines.add("No results found in " + result.collectionName() + ".");
            return lines;
        }
        int rank = 1;
        for (RetrievalHit hit : result.hits()) {
            lines.add("");
            lines.add("Result #" + rank++);
            if (hit.hasScore()) {
                lines.add("Score: " + hit.score());
            }
            String source = hit.chunk().source();
            if (source != null && !source.isBlank()) {
                lines.add("Source: " + source);
            }
            lines.add(snippet(hit.chunk().content()));
        }
        return lines;
    }

    @Override
    public List<String> formatStats(List<CollectionStats> stats) {
        List<String> lines = new ArrayList<>();
        if (stats.isEmpty()) {
            lines.add("No collections found.");
            return lines;
        }
        lines.add("");
        lines.add("Collections:");
        for (CollectionStats entry : stats) {
            lines.add("- " + entry.name());
            lines.add("  Items: " + entry.count());
            lines.add("  Sample sources: " + entry.sampleSources());
            if (entry.degraded()) {
                lines.add("  Degraded: " + entry.error());
            }
        }
        return lines;
    }

    @Override
    public List<String> formatInfo(CollectionInfo info) {
        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.add("Collection: " + info.name());
        if (info.sourceDocument() != null) {
            lines.add("Document: " + info.sourceDocument());
        }
        lines.add("Number of chunks: " + info.count());
        lines.add("Database size: " + humanReadableSize(info.storeSizeBytes()) + " (shared across all collections)");
        lines.add("Embedding model: " + info.embeddingModel());
        lines.add("Persist directory: " + info.persistDir());
        if (!info.collectionMetadata().isEmpty()) {
            lines.add("Collection metadata: " + info.collectionMetadata());
        }
        return lines;
    }

    @Override
    public List<String> formatAnswer(RagAnswer answer) {
        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.add("Answer:");
        lines.add(answer.answer());
        if (!answer.sources().isEmpty()) {
            lines.add("Sources: " + String.join(", ", answer.sources()));
        }
        return lines;
    }

    static String snippet(String content) {
        String text = content == null ? "" : content.strip();
        return text.length() < SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH) + "...";
    }

    static String humanReadableSize(long bytes) {
        if (bytes < MEGABYTE) {
            return String.format(Locale.ROOT, "%.2f KB", bytes / 1024.0);
        }
        return String.format(Locale.ROOT, "%.2f MB", bytes / (double) MEGABYTE);
    }
}
