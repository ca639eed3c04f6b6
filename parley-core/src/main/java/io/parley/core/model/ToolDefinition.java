package io.parley.core.model;

import java.util.Map;
import java.util.Objects;

public record ToolDefinition(String name, String description, Map<String, Object> inputSchema) {

    public ToolDefinition {
        Objects.requireNonNull(name, "name must not be null");
        description = description == null || description.isBlank() ? "Tool: " + name : description;
        inputSchema = inputSchema == null || inputSchema.isEmpty()
            ? Map.of("type", "object", "properties", Map.of())
            : Map.copyOf(inputSchema);
    }
}
