package com.openforge.cortex.schema;

import com.openforge.cortex.llm.model.ToolSchema;

import java.util.Optional;
import java.util.Set;

public interface ToolSchemaRegistry {

    Optional<ToolSchema> find(String name);

    Set<String> names();

    /**
     * @throws SchemaNotFoundException when {@code name} is not registered
     */
    default ToolSchema require(String name) {
        return find(name).orElseThrow(() -> new SchemaNotFoundException(name));
    }
}
