package com.taskmanager.backend.modules.task.presentation.dto;

import com.taskmanager.backend.modules.task.domain.TaskStatus;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Priority is optional; an absent priority is stored as 1.
 */
public record CreateTaskRequest(
        @NotBlank(message = "title is required") @Size(max = 255) String title,
        String description,
        TaskStatus status,
        Integer priority
) {
}
