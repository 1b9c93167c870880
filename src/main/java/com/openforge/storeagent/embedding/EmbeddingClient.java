package com.openforge.storeagent.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Calls the OpenAI-compatible /embeddings endpoint and returns a float vector.
 * Same shape as LlmClient: raw HttpClient + Jackson.
 */
@Slf4j
@Component
public class EmbeddingClient {

    private static final int MAX_INPUT_CHARS = 8000;

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;

    public EmbeddingClient(HttpClient httpClient,
                           ObjectMapper objectMapper,
                           EmbeddingProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Embed a piece of text.
     *
     * @return vector of length {@link EmbeddingProperties#dimensions()}
     * @throws EmbeddingException on transport, HTTP or dimension errors
     */
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }
        String input = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;

        EmbeddingRequest request = EmbeddingRequest.of(input, props.model(), props.dimensions());
        String body = serialize(request);

        log.debug("[Embed] -> POST /embeddings model={} input-length={}", props.model(), input.length());

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/embeddings"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + props.apiKey())
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted calling embedding API", e);
        } catch (IOException e) {
            throw new EmbeddingException("Network error calling embedding API", e);
        }

        return parseResponse(response);
    }

    public int dimensions() {
        return props.dimensions();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private float[] parseResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();

        if (status == 429) throw new EmbeddingException("Embedding API rate-limited");
        if (status < 200 || status >= 300)
            throw new EmbeddingException("Embedding API returned HTTP %d: %s".formatted(status, body));

        float[] vector;
        try {
            vector = objectMapper.readValue(body, EmbeddingResponse.class).firstEmbedding();
        } catch (JsonProcessingException | IllegalStateException e) {
            throw new EmbeddingException("Failed to parse embedding response: " + body, e);
        }
        if (vector.length != props.dimensions()) {
            throw new EmbeddingException("Embedding model returned %d dims, expected %d"
                    .formatted(vector.length, props.dimensions()));
        }
        log.debug("[Embed] <- vector dim={}", vector.length);
        return vector;
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize embedding request", e);
        }
    }

    // ── Exception ────────────────────────────────────────────────────────────

    public static class EmbeddingException extends RuntimeException {
        public EmbeddingException(String message) { super(message); }
        public EmbeddingException(String message, Throwable cause) { super(message, cause); }
    }
}
