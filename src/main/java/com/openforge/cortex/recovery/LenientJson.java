package com.openforge.cortex.recovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.util.Optional;

/**
 * JSON reader that tolerates what small models commonly emit: unquoted keys,
 * single-quoted strings and trailing commas.
 */
final class LenientJson {

    private final ObjectReader reader;

    LenientJson(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader()
                .with(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES.mappedFeature())
                .with(JsonReadFeature.ALLOW_SINGLE_QUOTES.mappedFeature())
                .with(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature())
                .with(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS.mappedFeature());
    }

    Optional<JsonNode> read(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = reader.readTree(text.trim());
            return node == null || node.isMissingNode() ? Optional.empty() : Optional.of(node);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
