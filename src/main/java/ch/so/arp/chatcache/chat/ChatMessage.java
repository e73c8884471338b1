package ch.so.arp.chatcache.chat;

/**
 * One turn of a conversation.
 *
 * @param role    {@value #USER} or {@value #ASSISTANT}
 * @param content the text of the turn
 */
public record ChatMessage(String role, String content) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
}
