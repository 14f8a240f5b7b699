package com.contractdocs.rag.infra;

import dev.langchain4j.model.chat.ChatModel;

/**
 * Creates the client for the hosted language model. Creating a client is the
 * first point where network resources may be allocated.
 */
@FunctionalInterface
public interface ChatModelFactory {

    ChatModel create(String apiKey, String modelName);
}
