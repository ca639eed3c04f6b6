package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.parley.core.agent.AgentSettings;
import io.parley.core.provider.GenerationSettings;

/** The {@code agents} section. Only {@code defaults} is read; it configures every conversation. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentsConfig(AgentDefaults defaults) {

    public AgentsConfig {
        defaults = defaults == null ? AgentDefaults.defaults() : defaults;
    }

    public static AgentsConfig defaultConfig() {
        return new AgentsConfig(AgentDefaults.defaults());
    }

    public AgentSettings toAgentSettings() {
        return new AgentSettings(defaults.systemPrompt(), defaults.provider(), defaults.model(), defaults.maxIterations());
    }

    public GenerationSettings toGenerationSettings() {
        return new GenerationSettings(defaults.model(), defaults.maxTokens(), defaults.temperature());
    }
}
