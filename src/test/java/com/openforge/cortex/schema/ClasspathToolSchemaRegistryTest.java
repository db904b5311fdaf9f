package com.openforge.cortex.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.cortex.config.AppConfig;
import com.openforge.cortex.llm.model.ToolSchema;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;

class ClasspathToolSchemaRegistryTest {

    private final ObjectMapper objectMapper = AppConfig.createObjectMapper();

    @Test
    void shouldLoadBundledSchemasInFileOrder() {
        ClasspathToolSchemaRegistry registry = new ClasspathToolSchemaRegistry(objectMapper);

        assertThat(registry.names())
                .containsExactly("activateBrainArea", "decideCollapseStrategy", "enrichSemanticQuery");
    }

    @Test
    void shouldExposeParametersOfActivationSchema() {
        ToolSchema schema = new ClasspathToolSchemaRegistry(objectMapper).require("activateBrainArea");

        assertThat(schema.description()).isNotBlank();
        assertThat(schema.properties()).containsKeys("core", "intensity", "query", "keywords", "symbolicInsights");
        assertThat(schema.requiredProperties()).contains("core", "intensity", "query");
        assertThat(schema.properties().get("core").path("enum")).hasSize(16);
    }

    @Test
    void shouldThrowForUnknownSchema() {
        ClasspathToolSchemaRegistry registry = new ClasspathToolSchemaRegistry(objectMapper);

        assertThat(registry.find("summarize")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThatThrownBy(() -> registry.require("summarize"))
                .isInstanceOf(SchemaNotFoundException.class)
                .satisfies(e -> assertThat(((SchemaNotFoundException) e).schemaName()).isEqualTo("summarize"));
    }

    @Test
    void shouldRejectDuplicateNames() {
        assertThatThrownBy(() -> new ClasspathToolSchemaRegistry(objectMapper, "schemas/duplicate-schemas.json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate tool schema 'lookup'");
    }

    @Test
    void shouldRejectSchemaWithoutName() {
        assertThatThrownBy(() -> new ClasspathToolSchemaRegistry(objectMapper, "schemas/unnamed-schema.json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("without a name");
    }

    @Test
    void shouldRejectNonArrayFile() {
        assertThatThrownBy(() -> new ClasspathToolSchemaRegistry(objectMapper, "schemas/not-an-array.json"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldFailWhenFileIsMissing() {
        assertThatThrownBy(() -> new ClasspathToolSchemaRegistry(objectMapper, "schemas/absent.json"))
                .isInstanceOf(UncheckedIOException.class);
    }
}
