package com.openforge.cortex.embedding;

import java.util.List;

public record EmbeddingResponse(List<Float> embedding, String error) {}
