package io.parley.core.agent;

public record AgentSettings(
    String systemPrompt,
    String provider,
    String model,
    int maxIterations
) {
    public static final int DEFAULT_MAX_ITERATIONS = 5;
    public static final String DEFAULT_SYSTEM_PROMPT =
        "You are Parley, a helpful assistant. Use the available tools when they help answer the user.";

    public AgentSettings {
        maxIterations = maxIterations <= 0 ? DEFAULT_MAX_ITERATIONS : maxIterations;
        model = model == null || model.isBlank() ? "anthropic/claude-3-5-haiku-20241022" : model;
        systemPrompt = systemPrompt == null ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
        provider = provider == null ? "" : provider;
    }
}
