package io.parley.core.tool.impl;

import io.parley.core.integration.remote.RemoteToolInvoker;
import io.parley.core.model.ToolDefinition;
import io.parley.core.session.SessionCredentials;
import io.parley.core.tool.Tool;
import io.parley.core.tool.ToolContext;
import io.parley.core.tool.ToolExecutionException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A tool served by the remote tool server. The session's credentials travel with every call under
 * {@link #CREDENTIALS_ARGUMENT}.
 */
public final class RemoteTool implements Tool {
    public static final String CREDENTIALS_ARGUMENT = "_credentials";

    private final ToolDefinition definition;
    private final RemoteToolInvoker invoker;

    public RemoteTool(ToolDefinition definition, RemoteToolInvoker invoker) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
    }

    @Override
    public String name() {
        return definition.name();
    }

    @Override
    public String description() {
        return definition.description();
    }

    @Override
    public Map<String, Object> schema() {
        return definition.inputSchema();
    }

    @Override
    public ToolDefinition definition() {
        return definition;
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) throws ToolExecutionException {
        Map<String, Object> arguments = new LinkedHashMap<>(input);
        arguments.remove(CREDENTIALS_ARGUMENT);
        SessionCredentials credentials = context.session().credentials();
        if (!credentials.isEmpty()) {
            arguments.put(CREDENTIALS_ARGUMENT, credentials.values());
        }
        return invoker.callTool(definition.name(), arguments);
    }
}
