package io.parley.core.agent;

import io.parley.core.model.Turn;
import io.parley.core.provider.TokenUsage;
import java.util.List;

public record LoopResult(
    String responseText,
    List<Turn> history,
    int iterations,
    boolean boundReached,
    TokenUsage usage
) {
    public LoopResult {
        responseText = responseText == null ? "" : responseText;
        history = history == null ? List.of() : List.copyOf(history);
        usage = usage == null ? TokenUsage.NONE : usage;
    }
}
