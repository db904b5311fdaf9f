package com.openforge.cortex.recovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last-resort extraction of JSON objects from free text.
 *
 * Candidate spans, in priority order:
 *   1. fenced code blocks (```json, ``` or ```tool)
 *   2. the innermost balanced object around each marker field
 *   3. every balanced top-level object
 * Each span is decoded leniently; spans that do not decode are skipped.
 */
@Slf4j
@Component
public class JsonObjectSalvager {

    private static final Pattern FENCED_BLOCK = Pattern.compile(
            "```[a-zA-Z]*\\s*([\\s\\S]*?)```");

    private final LenientJson lenientJson;

    public JsonObjectSalvager(ObjectMapper objectMapper) {
        this.lenientJson = new LenientJson(objectMapper);
    }

    public List<ObjectNode> salvage(String content, List<String> markerFields) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        Set<String> spans = new LinkedHashSet<>();

        Matcher fenced = FENCED_BLOCK.matcher(content);
        while (fenced.find()) {
            spans.add(fenced.group(1).trim());
        }

        JsonSpans.ObjectIndex objects = JsonSpans.objectIndex(content);
        for (String marker : markerFields) {
            Matcher occurrence = markerPattern(marker).matcher(content);
            while (occurrence.find()) {
                String enclosing = objects.enclosingObject(occurrence.start());
                if (enclosing != null) {
                    spans.add(enclosing);
                }
            }
        }

        spans.addAll(objects.topLevelObjects());

        List<ObjectNode> decodedObjects = new ArrayList<>();
        for (String span : spans) {
            Optional<JsonNode> decoded = lenientJson.read(span);
            if (decoded.isEmpty()) {
                log.debug("[Salvage] Skipping undecodable span ({} chars)", span.length());
                continue;
            }
            JsonNode node = decoded.get();
            if (node instanceof ObjectNode object) {
                decodedObjects.add(object);
            } else if (node.isArray()) {
                node.forEach(element -> {
                    if (element instanceof ObjectNode object) {
                        decodedObjects.add(object);
                    }
                });
            }
        }
        return decodedObjects;
    }

    private static Pattern markerPattern(String marker) {
        String quoted = Pattern.quote(marker);
        return Pattern.compile("[\"']" + quoted + "[\"']\\s*:|(?<![\\w\"'])" + quoted + "\\s*:");
    }
}
