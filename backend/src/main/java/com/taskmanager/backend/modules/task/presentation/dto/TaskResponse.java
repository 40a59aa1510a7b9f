package com.taskmanager.backend.modules.task.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskmanager.backend.modules.task.domain.Task;
import com.taskmanager.backend.modules.task.domain.TaskStatus;

public record TaskResponse(
        Long id,
        String title,
        String description,
        TaskStatus status,
        int priority,
        @JsonProperty("owner_id") Long ownerId,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("updated_at") OffsetDateTime updatedAt
) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.getId(),
                task.getTitle(),
                task.getDescription(),
                task.getStatus(),
                task.getPriority(),
                task.getOwnerId(),
                task.getCreatedAt(),
                task.getUpdatedAt()
        );
    }
}
