package com.queryforge.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.queryforge.config.GenerationSettings;
import com.queryforge.model.ChatMessage;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("OpenAiCompletionProvider")
class OpenAiCompletionProviderTest {

    private static final List<ChatMessage> MESSAGES = List.of(
            ChatMessage.system("You are QueryForge"),
            ChatMessage.user("Database Type: MySQL"));

    private HttpClient httpClient;
    private HttpResponse<String> response;
    private OpenAiCompletionProvider provider;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        provider = providerWithKey("sk-test");
    }

    private OpenAiCompletionProvider providerWithKey(String apiKey) {
        OpenAiSettings settings = new OpenAiSettings("https://api.openai.com", apiKey, 30000, 1000);
        return new OpenAiCompletionProvider(new ObjectMapper(), settings, GenerationSettings.defaults(), httpClient);
    }

    private void respond(int status, String body) throws Exception {
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
    }

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        @DisplayName("requires an sk- prefixed key")
        void keyPrefix() {
            assertThat(providerWithKey("sk-abc").isConfigured()).isTrue();
            assertThat(providerWithKey("abc").isConfigured()).isFalse();
            assertThat(providerWithKey("").isConfigured()).isFalse();
            assertThat(providerWithKey(null).isConfigured()).isFalse();
        }

        @Test
        @DisplayName("refuses to call out without a key")
        void noKey() {
            OpenAiCompletionProvider unconfigured = providerWithKey(null);

            assertThatThrownBy(() -> unconfigured.complete("gpt-4", MESSAGES, 0.1))
                    .isInstanceOf(ProviderException.class)
                    .hasMessage("OpenAI API key not configured");
            verifyNoInteractions(httpClient);
        }

        @Test
        @DisplayName("exposes configured models and provider name")
        void models() {
            assertThat(provider.name()).isEqualTo("OpenAI");
            assertThat(provider.availableModels()).containsExactlyElementsOf(GenerationSettings.DEFAULT_MODELS);
        }
    }

    @Test
    @DisplayName("returns the first choice's content, trimmed")
    void success() throws Exception {
        respond(200, "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"  SELECT 1\\n\"}}]}");

        String content = provider.complete("gpt-4o", MESSAGES, 0.1);

        assertThat(content).isEqualTo("SELECT 1");

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        HttpRequest sent = captor.getValue();
        assertThat(sent.uri()).isEqualTo(URI.create("https://api.openai.com/v1/chat/completions"));
        assertThat(sent.method()).isEqualTo("POST");
        assertThat(sent.headers().firstValue("Authorization")).hasValue("Bearer sk-test");
        assertThat(sent.headers().firstValue("Content-Type")).hasValue("application/json");
    }

    @Test
    @DisplayName("uses the API error message on a non-200 response")
    void errorMessageFromBody() throws Exception {
        respond(401, "{\"error\":{\"message\":\"Incorrect API key provided\",\"type\":\"invalid_request_error\"}}");

        assertThatThrownBy(() -> provider.complete("gpt-4o", MESSAGES, 0.1))
                .isInstanceOf(ProviderException.class)
                .hasMessage("OpenAI API error: Incorrect API key provided");
    }

    @Test
    @DisplayName("falls back to the status code when the error body is not JSON")
    void errorStatusOnly() throws Exception {
        respond(502, "<html>Bad gateway</html>");

        assertThatThrownBy(() -> provider.complete("gpt-4o", MESSAGES, 0.1))
                .isInstanceOf(ProviderException.class)
                .hasMessage("OpenAI API error: HTTP 502");
    }

    @Test
    @DisplayName("fails when no choices are returned")
    void noChoices() throws Exception {
        respond(200, "{\"choices\":[]}");

        assertThatThrownBy(() -> provider.complete("gpt-4o", MESSAGES, 0.1))
                .isInstanceOf(ProviderException.class)
                .hasMessage("No response choices returned from OpenAI");
    }

    @Test
    @DisplayName("fails when the first choice carries no text content")
    void nullContent() throws Exception {
        respond(200, "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":null},"
                + "\"finish_reason\":\"content_filter\"}]}");

        assertThatThrownBy(() -> provider.complete("gpt-4o", MESSAGES, 0.1))
                .isInstanceOf(ProviderException.class)
                .hasMessage("No completion content returned from OpenAI");
    }

    @Test
    @DisplayName("wraps transport failures")
    void transportFailure() throws Exception {
        doThrow(new IOException("Connection refused")).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> provider.complete("gpt-4o", MESSAGES, 0.1))
                .isInstanceOf(ProviderException.class)
                .hasMessage("OpenAI request failed: Connection refused")
                .hasCauseInstanceOf(IOException.class);
    }
}
