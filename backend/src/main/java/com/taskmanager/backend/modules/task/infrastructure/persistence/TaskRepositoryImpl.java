package com.taskmanager.backend.modules.task.infrastructure.persistence;

import java.util.List;
import java.util.Objects;

import com.taskmanager.backend.modules.task.domain.Task;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class TaskRepositoryImpl implements TaskRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional(readOnly = true)
    public List<Task> searchTasks(TaskSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");
        if (condition.limit() == 0) {
            return List.of();
        }

        TaskQueryBuilder.BuiltQuery built = TaskQueryBuilder.build(condition);
        TypedQuery<Task> query = entityManager.createQuery(built.jpql(), Task.class);
        built.params().forEach(query::setParameter);
        query.setFirstResult(condition.offset());
        query.setMaxResults(condition.limit());
        return query.getResultList();
    }
}
