package io.parley.core.chat;

import io.parley.core.model.Turn;
import io.parley.core.session.SessionCredentials;
import java.util.List;

/**
 * One inbound message. {@code history}, when present, replaces the stored session history;
 * {@code systemPrompt}, when present, replaces the configured one for this request.
 */
public record ChatRequest(
    String ownerId,
    String sessionId,
    String message,
    List<Turn> history,
    String systemPrompt,
    SessionCredentials credentials
) {
    public ChatRequest {
        history = history == null ? List.of() : List.copyOf(history);
        credentials = credentials == null ? SessionCredentials.empty() : credentials;
    }

    public static ChatRequest of(String ownerId, String message) {
        return new ChatRequest(ownerId, null, message, null, null, null);
    }
}
