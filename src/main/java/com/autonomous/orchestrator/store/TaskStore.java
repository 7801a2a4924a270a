package com.autonomous.orchestrator.store;

import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskResult;
import com.autonomous.orchestrator.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable task records. Implementations report backing-store outages as {@link TaskStoreException}.
 */
public interface TaskStore {

    Task save(Task task);

    Optional<Task> findById(String taskId);

    Optional<Task> findByIdAndUserId(String taskId, String userId);

    /**
     * Newest first.
     */
    List<Task> findByUserId(String userId, int offset, int limit);

    List<Task> findByUserIdSince(String userId, Instant since);

    /**
     * Moves a task to {@code status}, rejecting transitions that go backwards.
     */
    Task updateStatus(String taskId, TaskStatus status, TaskResult result, String error);
}
