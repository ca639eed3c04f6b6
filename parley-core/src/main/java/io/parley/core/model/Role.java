package io.parley.core.model;

import java.util.Locale;

public enum Role {
    USER,
    ASSISTANT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Role fromWire(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "user" -> USER;
            case "assistant" -> ASSISTANT;
            default -> null;
        };
    }
}
