package ch.so.arp.chatcache.chat;

/**
 * Answer to a question together with where it came from.
 */
public record ChatAnswer(String chatId, String answer, Source source) {

    public enum Source {
        FAST_CACHE,
        SLOW_CACHE,
        GENERATED
    }
}
