package io.parley.core.model;

/**
 * A typed fragment of a {@link Turn}. The {@link #type()} tag matches the tag used on the wire.
 */
public interface Block {
    String TEXT = "text";
    String TOOL_USE = "tool_use";
    String TOOL_RESULT = "tool_result";

    String type();
}
