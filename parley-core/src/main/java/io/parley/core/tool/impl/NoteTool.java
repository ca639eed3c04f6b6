package io.parley.core.tool.impl;

import io.parley.core.session.Note;
import io.parley.core.tool.Tool;
import io.parley.core.tool.ToolContext;
import io.parley.core.tool.ToolExecutionException;
import java.util.List;
import java.util.Map;

public final class NoteTool implements Tool {

    @Override
    public String name() {
        return "create_note";
    }

    @Override
    public String description() {
        return "Create a note in the current session";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "title", Map.of("type", "string", "description", "Title of the note"),
                "content", Map.of("type", "string", "description", "Text content of the note")
            ),
            "required", List.of("title", "content")
        );
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) throws ToolExecutionException {
        String title = stringArg(input, "title");
        if (title.isBlank()) {
            throw new ToolExecutionException(name(), "title is required");
        }
        Note note = context.session().addNote(title, stringArg(input, "content"));
        return "Created note " + note.id() + ": " + note.title();
    }

    private String stringArg(Map<String, Object> input, String key) {
        Object value = input.get(key);
        return value == null ? "" : String.valueOf(value).trim();
    }
}
