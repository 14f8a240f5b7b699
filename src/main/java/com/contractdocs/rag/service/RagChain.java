package com.contractdocs.rag.service;

import com.contractdocs.rag.exception.GenerationFailedException;
import com.contractdocs.rag.infra.RateLimiter;
import com.contractdocs.rag.model.Chunk;
import com.contractdocs.rag.model.RagAnswer;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.rag.content.Content;
import dev.langchain4j.rag.content.retriever.ContentRetriever;
import dev.langchain4j.rag.query.Query;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Question answering over one collection: one retrieval, then one model call
 * with the retrieved chunks stuffed into the prompt. Keeps no state between calls.
 */
@Slf4j
@RequiredArgsConstructor
public class RagChain {

    public static final String GENERATION_LIMIT = "generation_limit";

    private static final String PROMPT_TEMPLATE =
        """
            Use the following pieces of context to answer the question at the end. \
            If you don't know the answer, just say that you don't know, don't try to make up an answer.

            %s

            Question: %s
            Helpful Answer:""";

    private final ContentRetriever retriever;
    private final ChatModel chatModel;
    private final String modelName;
    private final RateLimiter generationLimiter;

    public RagAnswer ask(String question) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question cannot be blank");
        }

        List<Content> contents = retriever.retrieve(Query.from(question));
        log.debug("Answering with {} context chunks using model {}", contents.size(), modelName);

        String context = contents.stream()
            .map(content -> content.textSegment().text())
            .collect(Collectors.joining("\n\n"));
        String prompt = String.format(PROMPT_TEMPLATE, context, question);

        String answer;
        try {
            answer = generationLimiter.execute(GENERATION_LIMIT, 1, () -> chatModel.chat(prompt));
        } catch (RuntimeException e) {
            log.error("Model {} failed to answer: {}", modelName, e.getMessage(), e);
            throw new GenerationFailedException(modelName, e);
        }

        List<String> sources = contents.stream()
            .map(content -> content.textSegment().metadata().getString(Chunk.SOURCE_KEY))
            .filter(Objects::nonNull)
            .distinct()
            .toList();

        return new RagAnswer(question, answer, sources);
    }

    public String modelName() {
        return modelName;
    }
}
