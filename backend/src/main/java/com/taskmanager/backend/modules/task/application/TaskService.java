package com.taskmanager.backend.modules.task.application;

import com.taskmanager.backend.global.error.ProblemException;
import com.taskmanager.backend.modules.auth.domain.AuthenticatedUser;
import com.taskmanager.backend.modules.task.domain.Task;
import com.taskmanager.backend.modules.task.domain.TaskStatus;
import com.taskmanager.backend.modules.task.infrastructure.persistence.TaskRepository;
import com.taskmanager.backend.modules.task.presentation.dto.CreateTaskRequest;
import com.taskmanager.backend.modules.task.presentation.dto.TaskResponse;
import com.taskmanager.backend.modules.task.presentation.dto.UpdateTaskRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Single-task operations. Every read, update and delete passes through {@link #loadOwnedTask}:
 * an unknown id is 404, a task owned by someone else is 400.
 */
@Service
@Transactional
public class TaskService {

    static final String TASK_NOT_FOUND = "TASK_NOT_FOUND";
    static final String NOT_ENOUGH_PERMISSIONS = "NOT_ENOUGH_PERMISSIONS";

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepository;

    public TaskService(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    public TaskResponse createTask(AuthenticatedUser owner, CreateTaskRequest request) {
        Task task = new Task(owner.id());
        task.setTitle(request.title());
        task.setDescription(request.description());
        task.setStatus(request.status() != null ? request.status() : TaskStatus.PENDING);
        task.setPriority(request.priority() != null ? request.priority() : Task.DEFAULT_PRIORITY);
        Task saved = taskRepository.saveAndFlush(task);
        log.debug("Created task id={} for user id={}", saved.getId(), owner.id());
        return TaskResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public TaskResponse getTask(AuthenticatedUser caller, Long taskId) {
        return TaskResponse.from(loadOwnedTask(caller, taskId));
    }

    public TaskResponse updateTask(AuthenticatedUser caller, Long taskId, UpdateTaskRequest request) {
        Task task = loadOwnedTask(caller, taskId);
        if (request.title() != null) {
            task.setTitle(request.title());
        }
        if (request.description() != null) {
            task.setDescription(request.description());
        }
        if (request.status() != null) {
            task.setStatus(request.status());
        }
        if (request.priority() != null) {
            task.setPriority(request.priority());
        }
        return TaskResponse.from(taskRepository.saveAndFlush(task));
    }

    public TaskResponse deleteTask(AuthenticatedUser caller, Long taskId) {
        Task task = loadOwnedTask(caller, taskId);
        TaskResponse snapshot = TaskResponse.from(task);
        taskRepository.delete(task);
        log.debug("Deleted task id={} for user id={}", taskId, caller.id());
        return snapshot;
    }

    Task loadOwnedTask(AuthenticatedUser caller, Long taskId) {
        Task task = taskRepository.findById(taskId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, TASK_NOT_FOUND, "Task not found"));
        if (!task.isOwnedBy(caller.id())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, NOT_ENOUGH_PERMISSIONS, "Not enough permissions");
        }
        return task;
    }
}
