package com.taskmanager.backend.modules.task.application;

import java.util.Locale;

import com.taskmanager.backend.modules.task.infrastructure.persistence.TaskSortField;

/**
 * Normalised list-query parameters. Out-of-range paging values are clamped instead of rejected.
 */
public record TaskQuery(
        int skip,
        int limit,
        TaskSortField sortBy,
        boolean descending,
        String search,
        String status
) {

    public static final int DEFAULT_LIMIT = 100;

    public static TaskQuery of(
            Integer skip,
            Integer limit,
            String sortBy,
            String sortOrder,
            String search,
            String status,
            int maxLimit
    ) {
        int safeSkip = skip == null ? 0 : Math.max(skip, 0);
        int requestedLimit = limit == null ? DEFAULT_LIMIT : limit;
        int safeLimit = Math.min(Math.max(requestedLimit, 0), maxLimit);
        boolean descending = sortOrder != null && "desc".equals(sortOrder.trim().toLowerCase(Locale.ROOT));
        String safeSearch = search == null || search.isBlank() ? null : search.trim();
        String safeStatus = status == null || status.isBlank() ? null : status.trim();
        return new TaskQuery(safeSkip, safeLimit, TaskSortField.resolve(sortBy), descending, safeSearch, safeStatus);
    }
}
