package com.queryforge.model;

import java.util.List;

/**
 * System and user instruction blocks rendered for one generation request.
 */
public record RenderedPrompt(String systemBlock, String userBlock) {

    /**
     * Chat messages in the order the provider expects them.
     *
     * @return system message followed by user message
     */
    public List<ChatMessage> toMessages() {
        return List.of(ChatMessage.system(systemBlock), ChatMessage.user(userBlock));
    }
}
