package ch.so.arp.chatcache.chat;

import java.time.Instant;
import java.util.List;

/**
 * A conversation thread together with its transcript in chronological order.
 */
public record ChatSession(String id, String title, Instant createdAt, List<ChatMessage> messages) {
}
