package io.parley.core.tool;

import java.util.Map;

/** Runs a named tool for the session bound to the calling thread. */
@FunctionalInterface
public interface ToolExecutor {
    ToolOutcome execute(String name, Map<String, Object> arguments) throws ToolExecutionException;
}
