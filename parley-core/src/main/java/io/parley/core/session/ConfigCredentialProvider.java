package io.parley.core.session;

import java.util.Map;
import java.util.Optional;

/** Serves per-owner credentials from the {@code credentials} section of the configuration file. */
public final class ConfigCredentialProvider implements CredentialProvider {
    private final Map<String, Map<String, String>> byOwner;

    public ConfigCredentialProvider(Map<String, Map<String, String>> byOwner) {
        this.byOwner = byOwner == null ? Map.of() : Map.copyOf(byOwner);
    }

    @Override
    public Optional<SessionCredentials> lookup(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            return Optional.empty();
        }
        Map<String, String> values = byOwner.get(ownerId);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new SessionCredentials(values));
    }
}
