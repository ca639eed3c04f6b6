package io.parley.core.session;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Secrets scoped to one session, such as a remote service token. Values never appear in
 * {@link #toString()}.
 */
public record SessionCredentials(Map<String, String> values) {

    public SessionCredentials {
        Map<String, String> cleaned = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((key, value) -> {
                if (key != null && !key.isBlank() && value != null) {
                    cleaned.put(key, value);
                }
            });
        }
        values = Map.copyOf(cleaned);
    }

    public static SessionCredentials empty() {
        return new SessionCredentials(Map.of());
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Returns a copy where entries of {@code other} replace entries with the same name. */
    public SessionCredentials mergedWith(SessionCredentials other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new LinkedHashMap<>(values);
        merged.putAll(other.values());
        return new SessionCredentials(merged);
    }

    @Override
    public String toString() {
        return "SessionCredentials" + values.keySet().stream().sorted().toList() + " (values masked)";
    }
}
