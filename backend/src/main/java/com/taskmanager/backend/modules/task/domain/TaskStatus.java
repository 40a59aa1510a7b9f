package com.taskmanager.backend.modules.task.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    DONE("done");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Accepts the wire value ({@code in_progress}), the enum name, or the hyphenated form.
     */
    public static Optional<TaskStatus> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(status -> status.value.equals(normalized))
                .findFirst();
    }

    @JsonCreator
    public static TaskStatus fromJson(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown task status: " + raw));
    }
}
