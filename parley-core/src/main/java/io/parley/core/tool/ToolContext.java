package io.parley.core.tool;

import io.parley.core.session.Session;
import java.util.Map;
import java.util.Objects;

public record ToolContext(Session session, Map<String, Object> services) {

    public ToolContext {
        Objects.requireNonNull(session, "session must not be null");
        services = services == null ? Map.of() : Map.copyOf(services);
    }

    public ToolContext(Session session) {
        this(session, Map.of());
    }

    public <T> T service(String key, Class<T> type) {
        Object service = services.get(key);
        if (service == null) {
            return null;
        }
        if (!type.isInstance(service)) {
            throw new IllegalArgumentException("Service '" + key + "' is not of type " + type.getSimpleName());
        }
        return type.cast(service);
    }
}
