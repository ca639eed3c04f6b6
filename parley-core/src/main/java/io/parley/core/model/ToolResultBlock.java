package io.parley.core.model;

public record ToolResultBlock(String invocationId, String content) implements Block {

    public ToolResultBlock {
        invocationId = invocationId == null ? "" : invocationId;
        content = content == null ? "" : content;
    }

    @Override
    public String type() {
        return TOOL_RESULT;
    }
}
