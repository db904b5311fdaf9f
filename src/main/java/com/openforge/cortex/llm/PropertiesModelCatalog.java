package com.openforge.cortex.llm;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * {@link ModelCatalog} backed by the {@code cortex.llm.models} list.
 *
 * Matching is on the base model name, so "qwen3:8b" and "qwen3:latest" share the
 * "qwen3" profile. An exact match beats a substring match; among substring
 * matches the longest profile name wins ("mistral-nemo" over "mistral").
 */
@Component
@RequiredArgsConstructor
public class PropertiesModelCatalog implements ModelCatalog {

    private final LlmProperties properties;

    @Override
    public Optional<String> defaultModel() {
        String model = properties.defaultModel();
        return model == null || model.isBlank() ? Optional.empty() : Optional.of(model.trim());
    }

    @Override
    public ModelTuning tuningFor(String model) {
        return profileFor(model)
                .map(p -> new ModelTuning(p.temperature(), p.maxTokens(), p.contextWindow()))
                .orElse(ModelTuning.NONE);
    }

    @Override
    public boolean supportsNativeTools(String model) {
        return profileFor(model).map(LlmProperties.ModelProfile::nativeTools).orElse(false);
    }

    Optional<LlmProperties.ModelProfile> profileFor(String model) {
        if (model == null || model.isBlank()) {
            return Optional.empty();
        }
        String base = baseName(model);
        Optional<LlmProperties.ModelProfile> exact = properties.models().stream()
                .filter(p -> p.name() != null && base.equals(p.name().toLowerCase(Locale.ROOT)))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return properties.models().stream()
                .filter(p -> p.name() != null && !p.name().isBlank())
                .filter(p -> base.contains(p.name().toLowerCase(Locale.ROOT)))
                .max(Comparator.comparingInt(p -> p.name().length()));
    }

    static String baseName(String model) {
        String lower = model.trim().toLowerCase(Locale.ROOT);
        int colon = lower.indexOf(':');
        return colon < 0 ? lower : lower.substring(0, colon);
    }
}
