package com.queryforge.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.queryforge.config.GenerationSettings;
import com.queryforge.model.ChatMessage;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link CompletionProvider} backed by the OpenAI chat-completions HTTP API.
 *
 * Uses the JDK HTTP client and Jackson directly rather than a vendor SDK.
 */
public class OpenAiCompletionProvider implements CompletionProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompletionProvider.class);

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final OpenAiSettings settings;
    private final GenerationSettings generationSettings;

    /**
     * Create a provider with its own HTTP client.
     *
     * @param objectMapper Jackson object mapper
     * @param settings client settings
     * @param generationSettings source of the model list
     */
    public OpenAiCompletionProvider(ObjectMapper objectMapper, OpenAiSettings settings, GenerationSettings generationSettings) {
        this(objectMapper, settings, generationSettings, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    OpenAiCompletionProvider(ObjectMapper objectMapper, OpenAiSettings settings,
                             GenerationSettings generationSettings, HttpClient httpClient) {
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.generationSettings = generationSettings;
        this.httpClient = httpClient;
    }

    /**
     * Log whether generation is possible. The API key itself is never logged.
     */
    @PostConstruct
    public void logConfigStatus() {
        if (settings.isEnabled()) {
            log.info("OpenAI provider is ENABLED (base_url={}, timeout_ms={}, max_tokens={})",
                    settings.baseUrl(), settings.timeoutMs(), settings.maxTokens());
            return;
        }
        log.warn("OpenAI provider is DISABLED (base_url={}, api_key_configured={}). Set OPENAI_API_KEY to an sk- key.",
                settings.baseUrl(),
                settings.apiKey() != null && !settings.apiKey().isBlank());
    }

    @Override
    public String name() {
        return "OpenAI";
    }

    @Override
    public boolean isConfigured() {
        return settings.isEnabled();
    }

    @Override
    public List<String> availableModels() {
        return new ArrayList<>(generationSettings.availableModels());
    }

    @Override
    public String complete(String model, List<ChatMessage> messages, double temperature) {
        if (!settings.isEnabled()) {
            throw new ProviderException("OpenAI API key not configured");
        }

        HttpResponse<String> response;
        try {
            String json = objectMapper.writeValueAsString(buildPayload(model, messages, temperature));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(settings.completionsUrl()))
                    .timeout(Duration.ofMillis(settings.timeoutMs()))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + settings.apiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("OpenAI request interrupted", e);
        } catch (IOException e) {
            throw new ProviderException("OpenAI request failed: " + e.getMessage(), e);
        }

        if (response.statusCode() != 200) {
            log.warn("OpenAI request failed (status_code={}, base_url={}, model={})",
                    response.statusCode(), settings.baseUrl(), model);
            throw new ProviderException("OpenAI API error: " + errorDetail(response));
        }

        JsonNode choices;
        try {
            choices = objectMapper.readTree(response.body()).path("choices");
        } catch (IOException e) {
            throw new ProviderException("OpenAI returned an unreadable response: " + e.getMessage(), e);
        }
        if (!choices.isArray() || choices.isEmpty()) {
            throw new ProviderException("No response choices returned from OpenAI");
        }

        JsonNode content = choices.path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new ProviderException("No completion content returned from OpenAI");
        }
        return content.asText().strip();
    }

    private Map<String, Object> buildPayload(String model, List<ChatMessage> messages, double temperature) {
        List<Map<String, String>> wireMessages = new ArrayList<>(messages.size());
        for (ChatMessage m : messages) {
            wireMessages.add(Map.of("role", m.role(), "content", m.content()));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", wireMessages);
        payload.put("temperature", temperature);
        payload.put("max_tokens", settings.maxTokens());
        payload.put("stream", false);
        return payload;
    }

    private String errorDetail(HttpResponse<String> response) {
        String detail = "HTTP " + response.statusCode();
        String body = response.body();
        if (body == null || body.isBlank()) {
            return detail;
        }
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            if (message.isTextual() && !message.asText().isBlank()) {
                return message.asText();
            }
        } catch (IOException e) {
            log.debug("OpenAI error body is not JSON", e);
        }
        return detail;
    }
}
