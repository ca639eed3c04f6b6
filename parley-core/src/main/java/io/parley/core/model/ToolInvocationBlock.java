package io.parley.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A model-issued request to run a named tool. The {@code id} is unique within a conversation and is
 * echoed back by the matching {@link ToolResultBlock}.
 */
public record ToolInvocationBlock(String id, String name, Map<String, Object> arguments) implements Block {

    public ToolInvocationBlock {
        id = id == null ? "" : id;
        name = name == null ? "" : name;
        // Tool arguments may legitimately contain JSON nulls, which Map.copyOf rejects.
        arguments = arguments == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    @Override
    public String type() {
        return TOOL_USE;
    }

    public boolean isValid() {
        return !id.isBlank() && !name.isBlank();
    }
}
