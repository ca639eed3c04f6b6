package io.parley.core.model;

/**
 * A block whose tag is not understood. It is kept only until the conversation is repaired and is
 * never sent to a provider.
 */
public record UnsupportedBlock(String tag, String raw) implements Block {

    public UnsupportedBlock {
        tag = tag == null || tag.isBlank() ? "unknown" : tag;
        raw = raw == null ? "" : raw;
    }

    @Override
    public String type() {
        return tag;
    }
}
