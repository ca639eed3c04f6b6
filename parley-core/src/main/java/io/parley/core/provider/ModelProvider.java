package io.parley.core.provider;

import io.parley.core.model.ToolDefinition;
import io.parley.core.model.Turn;
import java.util.List;

public interface ModelProvider {
    String name();

    /**
     * Sends one request. Turns arrive already repaired and cache-annotated; adapters only translate
     * them to their wire format.
     */
    ProviderReply send(List<Turn> turns, List<ToolDefinition> tools, String conversationId, String systemPrompt);
}
