package io.parley.core.tool;

public record ToolOutcome(String content) {
    public ToolOutcome {
        content = content == null ? "" : content;
    }
}
