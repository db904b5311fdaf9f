package com.openforge.cortex.schema;

/**
 * A use case asked for a tool schema that is not registered. This is a
 * configuration error and is never converted into a default.
 */
public class SchemaNotFoundException extends RuntimeException {

    private final String schemaName;

    public SchemaNotFoundException(String schemaName) {
        super("Tool schema not registered: " + schemaName);
        this.schemaName = schemaName;
    }

    public String schemaName() {
        return schemaName;
    }
}
