package com.openforge.cortex.llm;

import java.util.Optional;

/**
 * Read-only knowledge about the installed models.
 */
public interface ModelCatalog {

    /** Model used when a request names none. */
    Optional<String> defaultModel();

    /** Settings that override request values for {@code model}; never null. */
    ModelTuning tuningFor(String model);

    /** Whether {@code model} accepts the native {@code tools} field. */
    boolean supportsNativeTools(String model);
}
