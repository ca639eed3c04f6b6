package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderConfig anthropic,
    ProviderConfig openai,
    ProviderConfig bedrock
) {

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(
            ProviderConfig.defaults(),
            ProviderConfig.defaults(),
            ProviderConfig.defaults()
        );
    }
}
