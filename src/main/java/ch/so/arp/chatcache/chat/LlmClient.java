package ch.so.arp.chatcache.chat;

import java.util.List;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke a real model server or return predictable responses for testing.
 */
public interface LlmClient {

    /**
     * Generate an answer for the prompt.
     *
     * @param prompt      the user question
     * @param history     earlier turns of the conversation, oldest first
     * @param temperature sampling temperature
     * @return the generated answer
     * @throws GenerationException if the model server fails
     */
    String generate(String prompt, List<ChatMessage> history, double temperature);
}
