package io.parley.core.tool;

import io.parley.core.model.ToolDefinition;
import java.util.Map;

public interface Tool {
    String name();

    String description();

    default Map<String, Object> schema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    String execute(Map<String, Object> input, ToolContext context) throws ToolExecutionException;

    default ToolDefinition definition() {
        return new ToolDefinition(name(), description(), schema());
    }
}
