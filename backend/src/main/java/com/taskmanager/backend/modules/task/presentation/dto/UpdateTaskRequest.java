package com.taskmanager.backend.modules.task.presentation.dto;

import com.taskmanager.backend.modules.task.domain.TaskStatus;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update: only non-null fields are applied.
 */
public record UpdateTaskRequest(
        @Size(max = 255) @Pattern(regexp = "(?s).*\\S.*", message = "title must not be blank") String title,
        String description,
        TaskStatus status,
        Integer priority
) {
}
