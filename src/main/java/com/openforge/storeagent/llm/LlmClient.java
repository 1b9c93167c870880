package com.openforge.storeagent.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.storeagent.llm.model.ChatRequest;
import com.openforge.storeagent.llm.model.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Stateless client for an OpenAI-compatible /chat/completions endpoint.
 *
 * Failures are split in two families so the retry layer can tell them apart:
 *
 *   LlmTransientException  network errors, timeouts, 408, 429 and 5xx
 *   LlmException           anything else (bad request, auth, unparsable body)
 */
@Slf4j
public class LlmClient {

    private static final int MAX_ERROR_BODY = 2048;

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /** Blocking chat completion; the model is filled in from the provider config when absent. */
    public ChatResponse chat(ChatRequest request) {
        if (request == null) {
            throw new LlmException("ChatRequest must not be null for provider [%s]"
                    .formatted(config.name()));
        }
        ChatRequest effective = request.model() == null || request.model().isBlank()
                ? request.withModel(config.model())
                : request;

        String requestBody = serialize(effective);
        log.debug("[LlmClient:{}] -> chat POST body-length={}", config.name(), requestBody.length());

        HttpResponse<String> httpResponse = sendBlocking(buildHttpRequest(requestBody));
        return parseFullResponse(httpResponse);
    }

    /** The model name configured for this provider (e.g. "gpt-4o"). */
    public String modelName() {
        return config.model();
    }

    public String providerName() {
        return config.name();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body) {
        return HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private HttpResponse<String> sendBlocking(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmTransientException("Interrupted calling provider [%s]".formatted(config.name()), e);
        } catch (IOException e) {
            throw new LlmTransientException("Network error calling provider [%s]".formatted(config.name()), e);
        }
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient:{}] <- HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());

        if (status == 429) throw new LlmRateLimitException(
                "Rate-limited by provider [%s].".formatted(config.name()));
        if (status == 408 || status >= 500) throw new LlmTransientException(
                "Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, snippet(body)));
        if (status < 200 || status >= 300) throw new LlmException(
                "Provider [%s] rejected the request with HTTP %d: %s".formatted(config.name(), status, snippet(body)));

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException(
                    "Failed to parse response from provider [%s]: %s".formatted(config.name(), snippet(body)), e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize request", e);
        }
    }

    private static String snippet(String body) {
        if (body == null) return "";
        return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) + "..." : body;
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    /** Worth retrying: the same request may succeed a moment later. */
    public static class LlmTransientException extends LlmException {
        public LlmTransientException(String message) { super(message); }
        public LlmTransientException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmTransientException {
        public LlmRateLimitException(String message) { super(message); }
    }
}
