package com.openforge.cortex.llm;

/**
 * Per-model generation settings. A null field means "no opinion".
 */
public record ModelTuning(Double temperature, Integer maxTokens, Integer contextWindow) {

    public static final ModelTuning NONE = new ModelTuning(null, null, null);
}
