package com.openforge.cortex.embedding;

/**
 * Body of POST /api/embeddings.
 */
public record EmbeddingRequest(String model, String prompt) {}
