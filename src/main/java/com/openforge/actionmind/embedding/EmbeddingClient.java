package com.openforge.actionmind.embedding;

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
 * Pure-Java embedding client: raw HttpClient + Jackson, no SDK.
 *
 * Calls the OpenAI-compatible /embeddings endpoint (OpenAI, Ollama, LM Studio
 * and friends all speak it) and returns a float vector. Every failure is an
 * {@link EmbeddingException}; deciding what a failure means for the decision
 * cycle is left to {@link ResilientEmbeddingProvider}.
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
     * Embed a piece of text and return the float vector.
     *
     * @param text the text to embed (trimmed client-side to 8000 chars)
     * @return dense vector as returned by the model
     * @throws EmbeddingException on blank input, network, HTTP or parse failure
     */
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed blank text");
        }

        String input = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;

        EmbeddingRequest request = EmbeddingRequest.of(input, props.model(), props.dimensions());
        String body = serialize(request);

        log.debug("[Embed] → POST /embeddings model={} input-length={}", props.model(), input.length());

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(trimSlash(props.baseUrl()) + "/embeddings"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (props.apiKey() != null && !props.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + props.apiKey());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EmbeddingException("Network error calling embedding API", e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while calling embedding API", e, false);
        }

        return parseResponse(response);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private float[] parseResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();

        if (status == 429) throw new EmbeddingException("Embedding API rate-limited");
        if (status < 200 || status >= 300)
            throw new EmbeddingException("Embedding API returned HTTP %d: %s".formatted(status, body));

        try {
            EmbeddingResponse resp = objectMapper.readValue(body, EmbeddingResponse.class);
            float[] vector = resp.firstEmbedding();
            log.debug("[Embed] ← vector dim={}", vector.length);
            return vector;
        } catch (JsonProcessingException | IllegalStateException e) {
            throw new EmbeddingException("Failed to parse embedding response: " + body, e, false);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize embedding request", e, false);
        }
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // ── Exception ────────────────────────────────────────────────────────────

    public static class EmbeddingException extends RuntimeException {

        private final boolean networkError;

        public EmbeddingException(String message) {
            super(message);
            this.networkError = false;
        }

        public EmbeddingException(String message, Throwable cause, boolean networkError) {
            super(message, cause);
            this.networkError = networkError;
        }

        /** True when the request never got an HTTP answer; only these are retried. */
        public boolean isNetworkError() {
            return networkError;
        }
    }
}
