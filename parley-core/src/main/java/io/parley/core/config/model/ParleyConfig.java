package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ParleyConfig(
    AgentsConfig agents,
    SessionsConfig sessions,
    ProvidersConfig providers,
    Map<String, Map<String, String>> credentials,
    ToolsConfig tools
) {

    public ParleyConfig {
        credentials = credentials == null ? Map.of() : credentials;
    }

    public static ParleyConfig defaults() {
        return new ParleyConfig(
            AgentsConfig.defaultConfig(),
            SessionsConfig.defaults(),
            ProvidersConfig.defaults(),
            Map.of(),
            ToolsConfig.defaults()
        );
    }
}
