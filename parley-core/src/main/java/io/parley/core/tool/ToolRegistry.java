package io.parley.core.tool;

import io.parley.core.model.ToolDefinition;
import io.parley.core.session.SessionContext;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the tools offered to the model and executes them against the current session. Shared
 * services (such as the remote tool client) are handed to every tool through its
 * {@link ToolContext}.
 */
public final class ToolRegistry implements ToolExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final Map<String, Object> services;

    public ToolRegistry() {
        this(Map.of());
    }

    public ToolRegistry(Map<String, Object> services) {
        this.services = services == null ? Map.of() : Map.copyOf(services);
    }

    public void register(Tool tool) {
        Tool previous = tools.put(tool.name(), tool);
        if (previous != null) {
            LOG.warn("Tool {} was registered twice; the later registration wins", tool.name());
        }
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(name == null ? null : tools.get(name));
    }

    public Collection<Tool> all() {
        return tools.values();
    }

    public List<ToolDefinition> definitions() {
        return tools.values().stream()
            .map(Tool::definition)
            .sorted(Comparator.comparing(ToolDefinition::name))
            .toList();
    }

    @Override
    public ToolOutcome execute(String name, Map<String, Object> arguments) throws ToolExecutionException {
        Tool tool = find(name).orElseThrow(() -> new ToolExecutionException(name, "Unknown tool: " + name));
        ToolContext context = new ToolContext(SessionContext.current(), services);
        long started = System.nanoTime();
        String content = tool.execute(arguments == null ? Map.of() : arguments, context);
        LOG.debug("Tool {} completed in {}ms for session {}",
            name, (System.nanoTime() - started) / 1_000_000, context.session().sessionId());
        return new ToolOutcome(content);
    }
}
