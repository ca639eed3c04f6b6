package io.parley.core.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Narrowing of the tools offered per message. {@code contextKeywords} maps a context name to the
 * words that reveal it in a message; {@code toolContexts} maps a tool name to the contexts it serves.
 */
public record ToolSelectionSettings(
    boolean enabled,
    boolean modelAssisted,
    Map<String, List<String>> contextKeywords,
    Map<String, List<String>> toolContexts
) {

    public ToolSelectionSettings {
        contextKeywords = contextKeywords == null ? Map.of() : copyOf(contextKeywords);
        toolContexts = toolContexts == null ? Map.of() : copyOf(toolContexts);
    }

    public static ToolSelectionSettings disabled() {
        return new ToolSelectionSettings(false, false, Map.of(), Map.of());
    }

    public static Map<String, List<String>> defaultContextKeywords() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put("jira", List.of("jira", "ticket", "issue", "sprint", "board", "project", "epic", "story",
            "task", "bug", "backlog"));
        keywords.put("notes", List.of("note", "memo", "write", "remember", "document", "text", "save"));
        keywords.put("agile", List.of("sprint", "agile", "scrum", "kanban", "story", "epic", "release", "velocity"));
        keywords.put("communication", List.of("comment", "message", "chat", "discuss", "talk", "conversation",
            "reply"));
        keywords.put("search", List.of("search", "find", "query", "look for", "locate", "discover"));
        keywords.put("documents", List.of("file", "document", "attachment", "upload", "download", "read"));
        keywords.put("users", List.of("user", "assign", "assignee", "watcher", "member", "team", "person",
            "reporter"));
        return keywords;
    }

    public static Map<String, List<String>> defaultToolContexts() {
        Map<String, List<String>> contexts = new LinkedHashMap<>();
        contexts.put("create_note", List.of("notes", "writing", "document", "text"));
        contexts.put("list_notes", List.of("notes", "document", "search"));
        return contexts;
    }

    private static Map<String, List<String>> copyOf(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((key, values) -> copy.put(key, values == null ? List.of() : List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }
}
