package io.parley.core.codec;

import io.parley.core.model.Turn;
import java.util.List;

public record Transcript(List<Turn> turns, String systemPrompt) {
    public Transcript {
        turns = turns == null ? List.of() : List.copyOf(turns);
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
    }

    public static Transcript empty() {
        return new Transcript(List.of(), "");
    }
}
