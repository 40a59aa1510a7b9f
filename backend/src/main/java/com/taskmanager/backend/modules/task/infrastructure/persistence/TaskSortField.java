package com.taskmanager.backend.modules.task.infrastructure.persistence;

import java.util.Arrays;
import java.util.Locale;

/**
 * Allow-listed sort keys. Anything else falls back to {@link #ID} so the list endpoint stays permissive.
 */
public enum TaskSortField {
    ID("t.id", "id"),
    TITLE("t.title", "title"),
    PRIORITY("t.priority", "priority"),
    STATUS("t.status", "status"),
    CREATED_AT("t.createdAt", "created_at", "createdat"),
    UPDATED_AT("t.updatedAt", "updated_at", "updatedat");

    private final String path;
    private final String[] aliases;

    TaskSortField(String path, String... aliases) {
        this.path = path;
        this.aliases = aliases;
    }

    public String path() {
        return path;
    }

    public static TaskSortField resolve(String raw) {
        if (raw == null || raw.isBlank()) {
            return ID;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(field -> Arrays.asList(field.aliases).contains(normalized))
                .findFirst()
                .orElse(ID);
    }
}
