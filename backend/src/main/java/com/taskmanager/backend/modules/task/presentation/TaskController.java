package com.taskmanager.backend.modules.task.presentation;

import java.util.List;

import com.taskmanager.backend.modules.auth.domain.AuthenticatedUser;
import com.taskmanager.backend.modules.task.application.TaskQuery;
import com.taskmanager.backend.modules.task.application.TaskQueryService;
import com.taskmanager.backend.modules.task.application.TaskService;
import com.taskmanager.backend.modules.task.presentation.dto.CreateTaskRequest;
import com.taskmanager.backend.modules.task.presentation.dto.TaskResponse;
import com.taskmanager.backend.modules.task.presentation.dto.UpdateTaskRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tasks")
@Tag(name = "Tasks")
public class TaskController {

    private final TaskService taskService;
    private final TaskQueryService taskQueryService;

    public TaskController(TaskService taskService, TaskQueryService taskQueryService) {
        this.taskService = taskService;
        this.taskQueryService = taskQueryService;
    }

    @PostMapping({"", "/"})
    public ResponseEntity<TaskResponse> createTask(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @Valid @RequestBody CreateTaskRequest request
    ) {
        return ResponseEntity.ok(taskService.createTask(principal, request));
    }

    @Operation(
            summary = "List the caller's tasks",
            description = """
                    `sort_by` accepts id, title, priority, status, created_at, updated_at; other values sort by id. \
                    `search` is a case-insensitive substring match on title or description. \
                    Results are cached per caller and parameter set for 30 seconds, so recent writes may not show yet.
                    """
    )
    @GetMapping({"", "/"})
    public ResponseEntity<List<TaskResponse>> listTasks(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @RequestParam(name = "skip", required = false) Integer skip,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "sort_by", required = false) String sortBy,
            @RequestParam(name = "sort_order", required = false) String sortOrder,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "status", required = false) String status
    ) {
        TaskQuery query = taskQueryService.normalize(skip, limit, sortBy, sortOrder, search, status);
        return ResponseEntity.ok(taskQueryService.query(principal, query));
    }

    @Operation(summary = "Top-N tasks by priority", description = "Ties are ordered by creation time, oldest first.")
    @GetMapping({"/top_priority", "/top_priority/"})
    public ResponseEntity<List<TaskResponse>> topPriority(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @RequestParam(name = "n", required = false) Integer n
    ) {
        return ResponseEntity.ok(taskQueryService.topPriority(principal, n));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Task found"),
            @ApiResponse(responseCode = "400", description = "Task belongs to another user"),
            @ApiResponse(responseCode = "404", description = "Task not found")
    })
    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> getTask(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable("taskId") Long taskId
    ) {
        return ResponseEntity.ok(taskService.getTask(principal, taskId));
    }

    @PutMapping("/{taskId}")
    public ResponseEntity<TaskResponse> updateTask(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable("taskId") Long taskId,
            @Valid @RequestBody UpdateTaskRequest request
    ) {
        return ResponseEntity.ok(taskService.updateTask(principal, taskId, request));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<TaskResponse> deleteTask(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable("taskId") Long taskId
    ) {
        return ResponseEntity.ok(taskService.deleteTask(principal, taskId));
    }
}
