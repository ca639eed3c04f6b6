package io.parley.core.provider;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class ProviderRegistry {
    private final Map<String, ModelProvider> providers = new ConcurrentHashMap<>();

    public void register(ModelProvider provider) {
        providers.put(normalize(provider.name()), provider);
    }

    public Optional<ModelProvider> find(String name) {
        return Optional.ofNullable(providers.get(normalize(name)));
    }

    public Set<String> names() {
        return new TreeSet<>(providers.keySet());
    }

    private String normalize(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
