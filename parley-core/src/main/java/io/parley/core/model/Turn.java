package io.parley.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One message-level step of a conversation.
 *
 * <p>{@code cacheMarked} asks the provider to cache everything up to and including the first block
 * of this turn. Markers are recomputed for every outbound call and are not part of the stored
 * history.
 */
public record Turn(Role role, List<Block> blocks, boolean cacheMarked) {

    public Turn {
        Objects.requireNonNull(role, "role must not be null");
        blocks = blocks == null
            ? List.of()
            : blocks.stream().filter(Objects::nonNull).toList();
    }

    public Turn(Role role, List<Block> blocks) {
        this(role, blocks, false);
    }

    public static Turn user(String text) {
        return new Turn(Role.USER, List.of(new TextBlock(text)));
    }

    public static Turn user(Block... blocks) {
        return new Turn(Role.USER, Arrays.asList(blocks));
    }

    public static Turn assistant(String text) {
        return new Turn(Role.ASSISTANT, List.of(new TextBlock(text)));
    }

    public static Turn assistant(Block... blocks) {
        return new Turn(Role.ASSISTANT, Arrays.asList(blocks));
    }

    public Turn withCacheMarker() {
        return cacheMarked ? this : new Turn(role, blocks, true);
    }

    public Turn withoutCacheMarker() {
        return cacheMarked ? new Turn(role, blocks, false) : this;
    }

    public boolean isUser() {
        return role == Role.USER;
    }

    public boolean isAssistant() {
        return role == Role.ASSISTANT;
    }

    public List<ToolInvocationBlock> toolInvocations() {
        return blocks.stream()
            .filter(ToolInvocationBlock.class::isInstance)
            .map(ToolInvocationBlock.class::cast)
            .toList();
    }

    public List<ToolResultBlock> toolResults() {
        return blocks.stream()
            .filter(ToolResultBlock.class::isInstance)
            .map(ToolResultBlock.class::cast)
            .toList();
    }

    /** Text of all text blocks, joined with newlines. */
    public String text() {
        return blocks.stream()
            .filter(TextBlock.class::isInstance)
            .map(block -> ((TextBlock) block).text())
            .filter(text -> !text.isBlank())
            .collect(Collectors.joining("\n"));
    }
}
