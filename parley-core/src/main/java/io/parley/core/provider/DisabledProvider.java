package io.parley.core.provider;

import io.parley.core.model.ToolDefinition;
import io.parley.core.model.Turn;
import java.util.List;

/**
 * Stands in for a provider that is not configured. Every call fails, so fallback chains move past
 * it.
 */
public final class DisabledProvider implements ModelProvider {
    private final String name;
    private final String reason;

    public DisabledProvider(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "provider is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ProviderReply send(List<Turn> turns, List<ToolDefinition> tools, String conversationId, String systemPrompt) {
        throw new ProviderException(name, "not configured (" + reason + ")");
    }
}
