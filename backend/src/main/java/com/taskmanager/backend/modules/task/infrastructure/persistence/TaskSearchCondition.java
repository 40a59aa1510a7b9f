package com.taskmanager.backend.modules.task.infrastructure.persistence;

import java.util.Objects;

import com.taskmanager.backend.modules.task.domain.TaskStatus;

public record TaskSearchCondition(
        Long ownerId,
        TaskStatus status,
        String keyword,
        TaskSortField sortField,
        boolean descending,
        int offset,
        int limit
) {

    public TaskSearchCondition {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        sortField = sortField == null ? TaskSortField.ID : sortField;
        if (offset < 0 || limit < 0) {
            throw new IllegalArgumentException("offset and limit must not be negative");
        }
    }
}
