package io.parley.core.provider;

import io.parley.core.model.ToolDefinition;
import io.parley.core.model.Turn;
import java.util.List;

/** Offline provider that answers with the text of the last user turn. */
public final class EchoProvider implements ModelProvider {
    private final String name;

    public EchoProvider(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ProviderReply send(List<Turn> turns, List<ToolDefinition> tools, String conversationId, String systemPrompt) {
        String lastUserText = turns.stream()
            .filter(Turn::isUser)
            .map(Turn::text)
            .filter(text -> !text.isBlank())
            .reduce((first, second) -> second)
            .orElse("");
        return ProviderReply.text("[" + name + "] " + lastUserText);
    }
}
