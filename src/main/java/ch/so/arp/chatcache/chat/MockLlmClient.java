package ch.so.arp.chatcache.chat;

import java.util.List;
import java.util.Locale;

/**
 * Deterministic {@link LlmClient} used in tests and local development where no
 * model server should be contacted.
 */
class MockLlmClient implements LlmClient {

    @Override
    public String generate(String prompt, List<ChatMessage> history, double temperature) {
        return String.format(Locale.ROOT,
                "[mocked answer] Start Ollama and set chat.mock-llm=false for real answers. "
                        + "Question was: %s (history: %d messages, temperature: %.1f)",
                prompt, history.size(), temperature);
    }
}
