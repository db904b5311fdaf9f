package com.openforge.cortex.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the local embeddings endpoint.
 *
 * application.yml:
 *
 * cortex:
 *   embedding:
 *     base-url: http://localhost:11434
 *     model: nomic-embed-text
 *     timeout-seconds: 30
 *     max-input-chars: 8000
 */
@ConfigurationProperties(prefix = "cortex.embedding")
public record EmbeddingProperties(
        @DefaultValue("http://localhost:11434") String baseUrl,
        @DefaultValue("nomic-embed-text") String model,
        @DefaultValue("30") int timeoutSeconds,
        @DefaultValue("8000") int maxInputChars
) {}
