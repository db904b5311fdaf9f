package com.openforge.cortex.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.cortex.llm.model.ToolSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tool schemas read once from a JSON array on the classpath
 * ({@code [{"name":..., "description":..., "parameters":{...}}, ...]}).
 */
@Slf4j
@Component
public class ClasspathToolSchemaRegistry implements ToolSchemaRegistry {

    public static final String DEFAULT_LOCATION = "tool-schemas.json";

    private final Map<String, ToolSchema> schemas;

    @Autowired
    public ClasspathToolSchemaRegistry(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_LOCATION);
    }

    public ClasspathToolSchemaRegistry(ObjectMapper objectMapper, String location) {
        this.schemas = Collections.unmodifiableMap(load(objectMapper, location));
        log.info("[Schemas] Loaded {} tool schema(s) from {}: {}", schemas.size(), location, schemas.keySet());
    }

    @Override
    public Optional<ToolSchema> find(String name) {
        return Optional.ofNullable(name == null ? null : schemas.get(name));
    }

    @Override
    public Set<String> names() {
        return schemas.keySet();
    }

    private static Map<String, ToolSchema> load(ObjectMapper objectMapper, String location) {
        ClassPathResource resource = new ClassPathResource(location);
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read tool schemas from classpath:" + location, e);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalStateException("Tool schema file must hold a JSON array: " + location);
        }

        Map<String, ToolSchema> loaded = new LinkedHashMap<>();
        for (JsonNode entry : root) {
            String name = entry.path("name").asText("");
            if (name.isBlank()) {
                throw new IllegalStateException("Tool schema without a name in " + location);
            }
            ToolSchema previous = loaded.put(name, new ToolSchema(
                    name,
                    entry.path("description").asText(""),
                    entry.path("parameters")));
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool schema '%s' in %s".formatted(name, location));
            }
        }
        return loaded;
    }
}
