package ch.so.arp.chatcache.chat;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for chat requests. The temperature is optional.
 */
public record ChatRequest(
        @NotBlank String question,
        @DecimalMin("0.0") @DecimalMax("2.0") Double temperature) {
}
