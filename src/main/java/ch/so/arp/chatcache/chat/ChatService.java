package ch.so.arp.chatcache.chat;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import ch.so.arp.chatcache.cache.CacheLookup;
import ch.so.arp.chatcache.cache.SemanticCache;
import ch.so.arp.chatcache.cache.StoreFailureException;

/**
 * Answers questions inside a chat. Cached answers are served from the
 * {@link SemanticCache}; everything else is generated by the language model and
 * written back to the cache. Both turns are appended to the chat transcript.
 */
@Service
public class ChatService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatService.class);

    static final String DEFAULT_TITLE = "New Chat";
    static final double DEFAULT_TEMPERATURE = 0.3d;
    private static final int TITLE_LENGTH = 30;

    private final LlmClient llmClient;
    private final SemanticCache semanticCache;
    private final ChatRepository chatRepository;

    public ChatService(LlmClient llmClient, SemanticCache semanticCache, ChatRepository chatRepository) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.semanticCache = Objects.requireNonNull(semanticCache, "semanticCache");
        this.chatRepository = Objects.requireNonNull(chatRepository, "chatRepository");
    }

    public ChatAnswer ask(String chatId, String question, Double temperature) {
        if (!chatRepository.exists(chatId)) {
            throw new ChatNotFoundException(chatId);
        }
        List<ChatMessage> history = chatRepository.findMessages(chatId);
        chatRepository.saveMessage(chatId, ChatMessage.USER, question);

        ChatAnswer answer = answer(chatId, question, history,
                temperature == null ? DEFAULT_TEMPERATURE : temperature);

        chatRepository.saveMessage(chatId, ChatMessage.ASSISTANT, answer.answer());
        if (history.isEmpty()) {
            chatRepository.updateTitle(chatId, title(question));
        }
        return answer;
    }

    public ChatSession startChat() {
        ChatSession chat = chatRepository.create(DEFAULT_TITLE);
        LOGGER.info("Started chat {}", chat.id());
        return chat;
    }

    public List<ChatSession> listChats() {
        return chatRepository.findAll();
    }

    public Optional<ChatSession> findChat(String chatId) {
        return chatRepository.findById(chatId);
    }

    public void renameChat(String chatId, String title) {
        if (!chatRepository.updateTitle(chatId, title)) {
            throw new ChatNotFoundException(chatId);
        }
    }

    public void deleteChat(String chatId) {
        if (chatRepository.delete(chatId)) {
            LOGGER.info("Deleted chat {}", chatId);
        }
    }

    public void deleteAllChats() {
        int deleted = chatRepository.deleteAll();
        LOGGER.info("Deleted {} chats", deleted);
    }

    // cuts on code points so that a surrogate pair is never split
    static String title(String question) {
        int codePoints = question.codePointCount(0, question.length());
        return question.substring(0, question.offsetByCodePoints(0, Math.min(TITLE_LENGTH, codePoints)));
    }

    private ChatAnswer answer(String chatId, String question, List<ChatMessage> history, double temperature) {
        CacheLookup lookup;
        try {
            lookup = semanticCache.lookup(question);
        } catch (StoreFailureException ex) {
            LOGGER.error("Cache lookup failed for question '{}', generating a fresh answer: {}", question,
                    ex.getMessage(), ex);
            lookup = null;
        }

        if (lookup != null && lookup.isHit()) {
            ChatAnswer.Source source = lookup.outcome() == CacheLookup.Outcome.FAST_HIT
                    ? ChatAnswer.Source.FAST_CACHE
                    : ChatAnswer.Source.SLOW_CACHE;
            return new ChatAnswer(chatId, lookup.response(), source);
        }

        String generated = llmClient.generate(question, history, temperature);
        if (lookup != null) {
            try {
                semanticCache.record(question, lookup.embedding(), generated);
            } catch (StoreFailureException ex) {
                LOGGER.error("Unable to cache answer for question '{}': {}", question, ex.getMessage(), ex);
            }
        }
        return new ChatAnswer(chatId, generated, ChatAnswer.Source.GENERATED);
    }
}
