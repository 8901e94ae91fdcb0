package com.queryforge.provider;

import com.queryforge.config.EnvironmentValues;
import org.springframework.core.env.Environment;

/**
 * Immutable OpenAI client configuration resolved from properties or environment variables.
 */
public record OpenAiSettings(
        String baseUrl,
        String apiKey,
        int timeoutMs,
        int maxTokens
) {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com";
    public static final int DEFAULT_TIMEOUT_MS = 30000;
    public static final int DEFAULT_MAX_TOKENS = 1000;

    private static final String KEY_PREFIX = "sk-";

    public static OpenAiSettings fromEnvironment(Environment environment) {
        String baseUrl = EnvironmentValues.getString(environment,
                "queryforge.openai.base-url", "OPENAI_BASE_URL", DEFAULT_BASE_URL);
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return new OpenAiSettings(
                baseUrl,
                EnvironmentValues.getTrimmed(environment, "queryforge.openai.api-key", "OPENAI_API_KEY"),
                EnvironmentValues.getInt(environment,
                        "queryforge.openai.timeout-ms", "OPENAI_TIMEOUT_MS", DEFAULT_TIMEOUT_MS),
                EnvironmentValues.getInt(environment,
                        "queryforge.openai.max-tokens", "OPENAI_MAX_TOKENS", DEFAULT_MAX_TOKENS)
        );
    }

    /**
     * An API key is usable only when it has the OpenAI secret-key prefix.
     */
    boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank() && apiKey.startsWith(KEY_PREFIX);
    }

    String completionsUrl() {
        return baseUrl + "/v1/chat/completions";
    }
}
