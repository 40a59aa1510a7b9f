package com.taskmanager.backend.modules.task.infrastructure.persistence;

import java.util.List;

import com.taskmanager.backend.modules.task.domain.Task;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

public interface TaskRepository extends JpaRepository<Task, Long>, TaskRepositoryCustom {

    @Transactional(readOnly = true)
    List<Task> findByOwnerIdOrderByPriorityDescCreatedAtAscIdAsc(Long ownerId, Pageable pageable);
}
