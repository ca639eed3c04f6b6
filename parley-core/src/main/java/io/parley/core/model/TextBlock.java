package io.parley.core.model;

public record TextBlock(String text) implements Block {

    public TextBlock {
        text = text == null ? "" : text;
    }

    @Override
    public String type() {
        return TEXT;
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
