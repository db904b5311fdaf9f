package com.openforge.cortex.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.net.URI;
import java.util.List;

/**
 * Externalised configuration for the local model server.
 *
 * Reads from application.yml under the "cortex.llm" prefix:
 *
 * cortex:
 *   llm:
 *     base-url: http://localhost:11434
 *     default-model: qwen3:latest
 *     timeout-seconds: 120
 *     retry-wait-millis: 250
 *     verify-installed-models: true
 *     fallback-models: [qwen3:4b, mistral:latest, mistral-nemo:latest, llama3.2:latest]
 *     models:
 *       - name: qwen3
 *         native-tools: true
 *         temperature: 0.7
 *         max-tokens: 4096
 *         context-window: 8192
 *       - name: gemma3
 *         native-tools: false
 *
 * A profile applies to every model whose base name (before ':') equals or
 * contains the profile name.
 *
 * With verify-installed-models on, a model missing from the server's /api/tags
 * list is replaced by the first installed entry of fallback-models.
 */
@ConfigurationProperties(prefix = "cortex.llm")
public record LlmProperties(
        @DefaultValue("http://localhost:11434") String baseUrl,
        String defaultModel,
        @DefaultValue("120") int timeoutSeconds,
        @DefaultValue("250") long retryWaitMillis,
        List<ModelProfile> models,
        @DefaultValue("true") boolean verifyInstalledModels,
        List<String> fallbackModels
) {

    public static final List<String> DEFAULT_FALLBACK_MODELS =
            List.of("qwen3:4b", "mistral:latest", "mistral-nemo:latest", "llama3.2:latest");

    public LlmProperties {
        models         = models == null ? List.of() : List.copyOf(models);
        fallbackModels = fallbackModels == null ? DEFAULT_FALLBACK_MODELS : List.copyOf(fallbackModels);
    }

    /** {@code path} resolved against base-url, tolerating a trailing slash on either side. */
    public URI endpoint(String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return URI.create(base + path);
    }

    public record ModelProfile(
            String name,
            @DefaultValue("false") boolean nativeTools,
            Double temperature,
            Integer maxTokens,
            Integer contextWindow
    ) {}
}
