package ch.so.arp.chatcache.chat;

public class ChatNotFoundException extends RuntimeException {

    public ChatNotFoundException(String chatId) {
        super("Chat '" + chatId + "' does not exist");
    }
}
