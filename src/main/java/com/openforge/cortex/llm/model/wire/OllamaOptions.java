package com.openforge.cortex.llm.model.wire;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Sampling and runtime options. {@code numGpu = 0} forces CPU inference.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OllamaOptions(
        Double temperature,
        Integer numPredict,
        Integer numCtx,
        Double topP,
        Double repeatPenalty,
        Integer numGpu
) {}
