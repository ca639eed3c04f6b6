package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolsConfig(RemoteToolsConfig remote, ToolSelectionConfig selection) {

    public ToolsConfig {
        remote = remote == null ? RemoteToolsConfig.defaults() : remote;
        selection = selection == null ? ToolSelectionConfig.defaults() : selection;
    }

    public static ToolsConfig defaults() {
        return new ToolsConfig(RemoteToolsConfig.defaults(), ToolSelectionConfig.defaults());
    }
}
