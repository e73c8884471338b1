package ch.so.arp.chatcache.chat;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Payload for renaming a chat.
 */
public record TitleRequest(@NotBlank @Size(max = 255) String title) {
}
