package com.openforge.cortex.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Embedding transport for the local model server. Raw HttpClient and Jackson only,
 * same as {@link com.openforge.cortex.llm.CompletionGateway}.
 *
 * Only moves vectors; storage and indexing live elsewhere.
 */
@Slf4j
@Component
public class EmbeddingClient {

    private static final String EMBEDDINGS_PATH = "/api/embeddings";

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
     * @param text the text to embed; cut to {@code max-input-chars} before sending
     * @return the vector, in the model's native dimension
     * @throws IllegalArgumentException for blank text
     */
    public CompletableFuture<List<Float>> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }

        String input = text.length() > props.maxInputChars() ? text.substring(0, props.maxInputChars()) : text;
        String body = serialize(new EmbeddingRequest(props.model(), input));

        log.debug("[Embed] → POST {} model={} input-length={}", EMBEDDINGS_PATH, props.model(), input.length());

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(stripTrailingSlash(props.baseUrl()) + EMBEDDINGS_PATH))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        throw new EmbeddingException("Network error calling embedding API", cause);
                    }
                    return parseResponse(response);
                });
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<Float> parseResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();

        if (status < 200 || status >= 300)
            throw new EmbeddingException("Embedding API returned HTTP %d: %s".formatted(status, body));

        try {
            EmbeddingResponse resp = objectMapper.readValue(body, EmbeddingResponse.class);
            if (resp.error() != null && !resp.error().isBlank()) {
                throw new EmbeddingException("Embedding API reported: " + resp.error());
            }
            if (resp.embedding() == null || resp.embedding().isEmpty()) {
                throw new EmbeddingException("Embedding API returned no vector");
            }
            log.debug("[Embed] ← vector dim={}", resp.embedding().size());
            return List.copyOf(resp.embedding());
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to parse embedding response: " + body, e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize embedding request", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // ── Exception ────────────────────────────────────────────────────────────

    public static class EmbeddingException extends RuntimeException {
        public EmbeddingException(String message) { super(message); }
        public EmbeddingException(String message, Throwable cause) { super(message, cause); }
    }
}
