package io.parley.core.provider;

public record TokenUsage(long inputTokens, long outputTokens, long cacheCreationInputTokens, long cacheReadInputTokens) {
    public static final TokenUsage NONE = new TokenUsage(0, 0, 0, 0);

    public TokenUsage plus(TokenUsage other) {
        if (other == null) {
            return this;
        }
        return new TokenUsage(
            inputTokens + other.inputTokens,
            outputTokens + other.outputTokens,
            cacheCreationInputTokens + other.cacheCreationInputTokens,
            cacheReadInputTokens + other.cacheReadInputTokens
        );
    }
}
