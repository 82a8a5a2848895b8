package com.phillippitts.voiceinventory.service.context;

import java.time.Instant;

/**
 * One turn of the voice conversation, kept for prompt context.
 */
public record ChatExchange(ExchangeRole role, String content, Instant timestamp) {

    public static ChatExchange user(String content) {
        return new ChatExchange(ExchangeRole.USER, content, Instant.now());
    }

    public static ChatExchange assistant(String content) {
        return new ChatExchange(ExchangeRole.ASSISTANT, content, Instant.now());
    }
}
