package io.parley.core.provider;

import io.parley.core.model.TextBlock;
import io.parley.core.model.ToolInvocationBlock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public record ProviderReply(List<TextBlock> textBlocks, ToolInvocationBlock toolRequest, TokenUsage usage) {
    public ProviderReply {
        textBlocks = textBlocks == null
            ? List.of()
            : textBlocks.stream().filter(block -> block != null && !block.isBlank()).toList();
        usage = usage == null ? TokenUsage.NONE : usage;
    }

    public static ProviderReply text(String text) {
        return new ProviderReply(List.of(new TextBlock(text)), null, TokenUsage.NONE);
    }

    public Optional<ToolInvocationBlock> tool() {
        return Optional.ofNullable(toolRequest);
    }

    public boolean hasToolRequest() {
        return toolRequest != null;
    }

    public String text() {
        return textBlocks.stream().map(TextBlock::text).collect(Collectors.joining("\n"));
    }
}
