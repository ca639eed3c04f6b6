package io.parley.core.provider;

import java.util.Locale;

/** Picks a provider by explicit name, falling back to hints in the model name. */
public final class ProviderRouter {
    private final ProviderRegistry registry;

    public ProviderRouter(ProviderRegistry registry) {
        this.registry = registry;
    }

    public ModelProvider resolve(String preferredProvider, String model) {
        if (preferredProvider != null && !preferredProvider.isBlank()) {
            return registry.find(preferredProvider)
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + preferredProvider));
        }

        String normalizedModel = model == null ? "" : model.toLowerCase(Locale.ROOT);
        if (normalizedModel.startsWith("bedrock/")) {
            return require("bedrock");
        }
        if (normalizedModel.startsWith("echo")) {
            return require("echo");
        }
        if (normalizedModel.contains("claude") || normalizedModel.startsWith("anthropic/")) {
            return require("anthropic");
        }
        if (normalizedModel.contains("gpt") || normalizedModel.startsWith("openai/")) {
            return require("openai");
        }
        throw new IllegalArgumentException("Cannot infer a provider for model '" + model + "'; set agents.defaults.provider");
    }

    private ModelProvider require(String name) {
        return registry.find(name)
            .orElseThrow(() -> new IllegalArgumentException("Provider " + name + " is not registered"));
    }
}
