package com.taskmanager.backend.modules.task.infrastructure.persistence;

import java.util.List;

import com.taskmanager.backend.modules.task.domain.Task;

public interface TaskRepositoryCustom {

    List<Task> searchTasks(TaskSearchCondition condition);
}
