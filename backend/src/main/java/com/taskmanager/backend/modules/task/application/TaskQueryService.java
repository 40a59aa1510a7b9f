package com.taskmanager.backend.modules.task.application;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.taskmanager.backend.global.cache.CacheKeys;
import com.taskmanager.backend.global.cache.ResponseCache;
import com.taskmanager.backend.modules.auth.domain.AuthenticatedUser;
import com.taskmanager.backend.modules.task.domain.TaskStatus;
import com.taskmanager.backend.modules.task.infrastructure.persistence.TaskRepository;
import com.taskmanager.backend.modules.task.infrastructure.persistence.TaskSearchCondition;
import com.taskmanager.backend.modules.task.presentation.dto.TaskResponse;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Owner-scoped task listing and priority ranking, served through the response cache.
 * Cached results may lag behind writes by up to the cache TTL. Only a cache miss reaches the
 * repository, whose read-only transaction covers the storage call alone.
 */
@Service
public class TaskQueryService {

    public static final int DEFAULT_TOP_N = 5;

    private static final TypeReference<List<TaskResponse>> TASK_LIST = new TypeReference<>() {
    };

    private final TaskRepository taskRepository;
    private final ResponseCache responseCache;
    private final Duration cacheTtl;
    private final String keyPrefix;
    private final int maxLimit;

    public TaskQueryService(
            TaskRepository taskRepository,
            ResponseCache responseCache,
            @Value("${taskflow.cache.ttl:30s}") Duration cacheTtl,
            @Value("${taskflow.cache.key-prefix:taskflow-cache}") String keyPrefix,
            @Value("${taskflow.tasks.max-limit:1000}") int maxLimit
    ) {
        this.taskRepository = taskRepository;
        this.responseCache = responseCache;
        this.cacheTtl = cacheTtl;
        this.keyPrefix = keyPrefix;
        this.maxLimit = maxLimit;
    }

    public TaskQuery normalize(
            Integer skip,
            Integer limit,
            String sortBy,
            String sortOrder,
            String search,
            String status
    ) {
        return TaskQuery.of(skip, limit, sortBy, sortOrder, search, status, maxLimit);
    }

    public List<TaskResponse> query(AuthenticatedUser owner, TaskQuery query) {
        String key = CacheKeys.of(keyPrefix, "tasks", owner.id(),
                "skip", query.skip(),
                "limit", query.limit(),
                "sort_by", query.sortBy().name(),
                "desc", query.descending(),
                "search", query.search(),
                "status", query.status());
        return responseCache.getOrCompute(key, cacheTtl, TASK_LIST, () -> loadTasks(owner.id(), query));
    }

    public List<TaskResponse> topPriority(AuthenticatedUser owner, Integer n) {
        int requested = n == null ? DEFAULT_TOP_N : n;
        int safeN = Math.min(requested, maxLimit);
        if (safeN <= 0) {
            return List.of();
        }
        String key = CacheKeys.of(keyPrefix, "tasks-top-priority", owner.id(), "n", safeN);
        return responseCache.getOrCompute(key, cacheTtl, TASK_LIST, () -> loadTopPriority(owner.id(), safeN));
    }

    List<TaskResponse> loadTasks(Long ownerId, TaskQuery query) {
        TaskStatus statusFilter = null;
        if (query.status() != null) {
            Optional<TaskStatus> parsed = TaskStatus.parse(query.status());
            if (parsed.isEmpty()) {
                return List.of();
            }
            statusFilter = parsed.get();
        }
        TaskSearchCondition condition = new TaskSearchCondition(
                ownerId,
                statusFilter,
                query.search(),
                query.sortBy(),
                query.descending(),
                query.skip(),
                query.limit()
        );
        return taskRepository.searchTasks(condition).stream()
                .map(TaskResponse::from)
                .toList();
    }

    List<TaskResponse> loadTopPriority(Long ownerId, int n) {
        return taskRepository.findByOwnerIdOrderByPriorityDescCreatedAtAscIdAsc(ownerId, PageRequest.of(0, n)).stream()
                .map(TaskResponse::from)
                .toList();
    }
}
