package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDefaults(
    String provider,
    String model,
    @JsonAlias({"max_tokens"}) int maxTokens,
    double temperature,
    @JsonAlias({"max_iterations"}) int maxIterations,
    @JsonAlias({"system_prompt"}) String systemPrompt,
    @JsonAlias({"worker_threads"}) int workerThreads,
    @JsonAlias({"request_timeout_seconds"}) int requestTimeoutSeconds
) {

    public static AgentDefaults defaults() {
        return new AgentDefaults(
            "anthropic",
            "anthropic/claude-3-5-haiku-20241022",
            1024,
            0.7,
            5,
            "You are Parley, a helpful assistant. Use the available tools when they help answer the user.",
            8,
            120
        );
    }
}
