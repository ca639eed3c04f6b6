package io.parley.core.chat;

import io.parley.core.model.Turn;
import java.util.List;

public record ChatResponse(
    String responseText,
    List<Turn> history,
    String sessionId,
    String conversationId,
    int iterations,
    boolean boundReached
) {
    public ChatResponse {
        history = history == null ? List.of() : List.copyOf(history);
    }
}
