package com.agentforge.orchestrator.repository;

import com.agentforge.orchestrator.model.Task;
import com.agentforge.orchestrator.model.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the tasks table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface TaskRepository extends JpaRepository<Task, UUID> {

    List<Task> findByStatusOrderByCreatedAtDesc(TaskStatus status);

    List<Task> findAllByOrderByCreatedAtDesc();
}
