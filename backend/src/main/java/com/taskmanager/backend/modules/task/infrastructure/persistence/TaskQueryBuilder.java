package com.taskmanager.backend.modules.task.infrastructure.persistence;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.util.StringUtils;

/**
 * Renders a {@link TaskSearchCondition} as JPQL. The owner predicate is always the first clause.
 */
final class TaskQueryBuilder {

    static final char LIKE_ESCAPE = '\\';

    private TaskQueryBuilder() {
    }

    static BuiltQuery build(TaskSearchCondition condition) {
        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new LinkedHashMap<>();

        whereClauses.add("t.ownerId = :ownerId");
        params.put("ownerId", condition.ownerId());

        if (condition.status() != null) {
            whereClauses.add("t.status = :status");
            params.put("status", condition.status());
        }

        if (StringUtils.hasText(condition.keyword())) {
            whereClauses.add("(lower(t.title) like :keyword escape '\\' "
                    + "or lower(t.description) like :keyword escape '\\')");
            params.put("keyword", "%" + escapeLike(condition.keyword().trim().toLowerCase(Locale.ROOT)) + "%");
        }

        String direction = condition.descending() ? "desc" : "asc";
        StringBuilder jpql = new StringBuilder("select t from Task t where ")
                .append(String.join(" and ", whereClauses))
                .append(" order by ").append(condition.sortField().path()).append(' ').append(direction);
        if (condition.sortField() != TaskSortField.ID) {
            jpql.append(", t.id asc");
        }
        return new BuiltQuery(jpql.toString(), params);
    }

    static String escapeLike(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    record BuiltQuery(String jpql, Map<String, Object> params) {
    }
}
