package com.queryforge.provider;

import com.queryforge.model.ChatMessage;

import java.util.List;

/**
 * Chat-completion capability consumed by the generator.
 */
public interface CompletionProvider {

    /**
     * @return display name of the provider, e.g. "OpenAI"
     */
    String name();

    /**
     * @return whether credentials are present so that {@link #complete} can be attempted
     */
    boolean isConfigured();

    /**
     * @return models clients may choose from
     */
    List<String> availableModels();

    /**
     * Run one chat completion.
     *
     * @param model model name
     * @param messages ordered messages
     * @param temperature sampling temperature
     * @return completion text
     * @throws ProviderException on transport failure, non-success status or an empty choice list
     */
    String complete(String model, List<ChatMessage> messages, double temperature);
}
