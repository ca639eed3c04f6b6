package io.parley.core.tool.impl;

import io.parley.core.session.Note;
import io.parley.core.tool.Tool;
import io.parley.core.tool.ToolContext;
import java.util.List;
import java.util.Map;

public final class ListNotesTool implements Tool {

    @Override
    public String name() {
        return "list_notes";
    }

    @Override
    public String description() {
        return "List the notes created in the current session";
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        List<Note> notes = context.session().notes();
        if (notes.isEmpty()) {
            return "No notes yet.";
        }
        StringBuilder out = new StringBuilder();
        for (Note note : notes) {
            if (!out.isEmpty()) {
                out.append('\n');
            }
            out.append(note.id()).append(". ").append(note.title());
            if (!note.content().isBlank()) {
                out.append(": ").append(note.content());
            }
        }
        return out.toString();
    }
}
