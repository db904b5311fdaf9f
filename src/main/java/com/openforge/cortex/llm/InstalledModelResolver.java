package com.openforge.cortex.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.cortex.llm.model.wire.OllamaTagsResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Checks the chosen model against the server's installed models before a chat call.
 *
 *  installed                      → kept
 *  missing, a fallback installed  → first installed entry of cortex.llm.fallback-models
 *  missing, no fallback installed → kept (the chat call reports the error)
 *  lookup failed                  → kept
 *
 * The returned future never fails.
 */
@Slf4j
@Component
public class InstalledModelResolver {

    private static final String   TAGS_PATH    = "/api/tags";
    private static final Duration TAGS_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient    httpClient;
    private final ObjectMapper  objectMapper;
    private final LlmProperties properties;

    public InstalledModelResolver(HttpClient httpClient, ObjectMapper objectMapper, LlmProperties properties) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.properties   = properties;
    }

    public CompletableFuture<String> resolve(String model) {
        if (!properties.verifyInstalledModels() || model == null || model.isBlank()) {
            return CompletableFuture.completedFuture(model);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(properties.endpoint(TAGS_PATH))
                .timeout(TAGS_TIMEOUT)
                .GET()
                .build();

        return httpClient
                .sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> choose(model, installedModels(response)))
                .exceptionally(error -> {
                    log.warn("[Models] Could not list installed models, keeping '{}': {}",
                            model, CompletionGateway.unwrap(error).getMessage());
                    return model;
                });
    }

    String choose(String model, Set<String> installed) {
        if (installed.contains(withTag(model))) {
            return model;
        }
        for (String fallback : properties.fallbackModels()) {
            if (fallback != null && installed.contains(withTag(fallback))) {
                log.warn("[Models] Model '{}' is not installed, using fallback '{}'", model, fallback);
                return fallback;
            }
        }
        log.warn("[Models] Model '{}' is not installed and no fallback is available ({} installed)",
                model, installed.size());
        return model;
    }

    private Set<String> installedModels(HttpResponse<String> response) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new CompletionGateway.LlmException(
                    "Model list returned status %d".formatted(response.statusCode()));
        }
        OllamaTagsResponse tags;
        try {
            tags = objectMapper.readValue(response.body(), OllamaTagsResponse.class);
        } catch (JsonProcessingException e) {
            throw new CompletionGateway.LlmException("Failed to parse model list", e);
        }
        Set<String> names = new LinkedHashSet<>();
        if (tags.models() != null) {
            tags.models().stream()
                    .filter(Objects::nonNull)
                    .map(OllamaTagsResponse.InstalledModel::name)
                    .filter(name -> name != null && !name.isBlank())
                    .map(InstalledModelResolver::withTag)
                    .forEach(names::add);
        }
        return names;
    }

    /** The server lists "qwen3" as "qwen3:latest". */
    static String withTag(String model) {
        String trimmed = model.trim();
        return trimmed.indexOf(':') < 0 ? trimmed + ":latest" : trimmed;
    }
}
