package io.parley.core.session;

import java.time.Instant;

public record Note(String id, String title, String content, Instant createdAt) {
    public Note {
        title = title == null ? "" : title;
        content = content == null ? "" : content;
    }
}
