package io.parley.core.integration.remote;

import io.parley.core.model.ToolDefinition;
import io.parley.core.tool.ToolExecutionException;
import java.io.IOException;
import java.util.List;
import java.util.Map;

public interface RemoteToolInvoker {
    List<ToolDefinition> listTools() throws IOException;

    String callTool(String toolName, Map<String, Object> arguments) throws ToolExecutionException;
}
