package io.parley.core.provider;

import io.parley.core.model.ToolDefinition;
import io.parley.core.model.Turn;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Tries each provider of the chain in order and returns the first successful reply. */
public final class FallbackProvider implements ModelProvider {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackProvider.class);
    private final String name;
    private final List<ModelProvider> chain;

    public FallbackProvider(String name, List<ModelProvider> chain) {
        this.name = name;
        this.chain = List.copyOf(chain);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ProviderReply send(List<Turn> turns, List<ToolDefinition> tools, String conversationId, String systemPrompt) {
        ProviderException last = null;
        for (ModelProvider provider : chain) {
            try {
                ProviderReply reply = provider.send(turns, tools, conversationId, systemPrompt);
                LOG.debug("Provider {} served request for chain {}", provider.name(), name);
                return reply;
            } catch (ProviderException e) {
                LOG.warn("Provider {} failed in chain {}: {}", provider.name(), name, truncate(e.getMessage(), 300));
                last = e;
            }
        }
        if (last == null) {
            throw new ProviderException(name, "no providers in fallback chain");
        }
        throw new ProviderException(name, "all providers failed; last error: " + last.getMessage(), last.statusCode(), last);
    }

    private String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }
}
