package io.parley.core.tool;

import io.parley.core.model.ToolDefinition;
import java.util.List;

/** The tools chosen for one message and how they were chosen. */
public record ToolSelection(List<ToolDefinition> tools, Method method, int availableCount) {

    public enum Method {
        ALL,
        KEYWORD,
        MODEL,
        NONE
    }

    public ToolSelection {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public boolean filtered() {
        return tools.size() < availableCount;
    }

    public int reductionPercent() {
        if (availableCount == 0) {
            return 0;
        }
        return Math.round((availableCount - tools.size()) * 100f / availableCount);
    }
}
