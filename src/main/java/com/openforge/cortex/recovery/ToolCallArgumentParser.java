package com.openforge.cortex.recovery;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonEOFException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.cortex.llm.model.RawArguments;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns {@link RawArguments} into a cleaned JSON object.
 *
 * Result contract:
 *   Structured            → deep-cleaned copy
 *   Text, valid object    → decoded object
 *   Text, blank/truncated → empty (the model ran out of tokens, not an error)
 *                           truncated also covers a syntax error on the last token,
 *                           e.g. {@code "intensity": 0.} or {@code "expand": tr}
 *   Text, anything else   → {@link MalformedArgumentsException}
 */
@Slf4j
@Component
public class ToolCallArgumentParser {

    private final ObjectMapper objectMapper;

    public ToolCallArgumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<ObjectNode> parse(RawArguments raw) {
        if (raw instanceof RawArguments.Structured structured) {
            return Optional.of(MarkupCleaner.cleanDeep(structured.value()));
        }
        String cleaned = MarkupCleaner.clean(((RawArguments.Text) raw).value());
        if (cleaned == null || cleaned.isBlank()) {
            return Optional.empty();
        }
        String text = cleaned.strip();

        JsonNode decoded;
        try {
            decoded = objectMapper.readTree(text);
        } catch (JsonParseException e) {
            if (!isTruncation(e, text)) {
                throw new MalformedArgumentsException(
                        "Arguments are not valid JSON: " + e.getOriginalMessage(), e);
            }
            log.debug("[ArgParser] Truncated arguments ({} chars), treating as absent", text.length());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            throw new MalformedArgumentsException(
                    "Arguments are not valid JSON: " + e.getOriginalMessage(), e);
        }

        if (decoded == null || decoded.isMissingNode()) {
            return Optional.empty();
        }
        if (!(decoded instanceof ObjectNode object)) {
            throw new MalformedArgumentsException(
                    "Arguments decoded to %s, expected an object".formatted(decoded.getNodeType()));
        }
        return Optional.of(object);
    }

    /** The parser hit end of input, or failed on the very last token of it. */
    static boolean isTruncation(JsonParseException e, String text) {
        if (e instanceof JsonEOFException) {
            return true;
        }
        JsonLocation location = e.getLocation();
        if (location != null && location.getCharOffset() >= 0) {
            return location.getCharOffset() >= text.length();
        }
        int open = text.indexOf('{');
        return open >= 0 && JsonSpans.matchingClose(text, open) < 0;
    }
}
