package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.parley.core.tool.ToolSelectionSettings;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolSelectionConfig(
    boolean enabled,
    @JsonAlias({"model_assisted"}) boolean modelAssisted,
    Map<String, List<String>> contexts,
    @JsonAlias({"tool_contexts"}) Map<String, List<String>> toolContexts
) {

    public ToolSelectionConfig {
        contexts = contexts == null ? Map.of() : contexts;
        toolContexts = toolContexts == null ? Map.of() : toolContexts;
    }

    public static ToolSelectionConfig defaults() {
        return new ToolSelectionConfig(
            false,
            true,
            ToolSelectionSettings.defaultContextKeywords(),
            ToolSelectionSettings.defaultToolContexts()
        );
    }

    public ToolSelectionSettings toSettings() {
        return new ToolSelectionSettings(enabled, modelAssisted, contexts, toolContexts);
    }
}
