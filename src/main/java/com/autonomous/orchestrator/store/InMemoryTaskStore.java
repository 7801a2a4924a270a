package com.autonomous.orchestrator.store;

import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskResult;
import com.autonomous.orchestrator.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Task store kept in process memory. Callers always receive copies.
 */
@Slf4j
@Repository
public class InMemoryTaskStore implements TaskStore {

    private static final Comparator<Task> NEWEST_FIRST =
        Comparator.comparing(Task::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTaskStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Task save(Task task) {
        tasks.put(task.getId(), copy(task));
        return task;
    }

    @Override
    public Optional<Task> findById(String taskId) {
        return Optional.ofNullable(tasks.get(taskId)).map(this::copy);
    }

    @Override
    public Optional<Task> findByIdAndUserId(String taskId, String userId) {
        return findById(taskId).filter(task -> task.getUserId().equals(userId));
    }

    @Override
    public List<Task> findByUserId(String userId, int offset, int limit) {
        return tasks.values().stream()
            .filter(task -> task.getUserId().equals(userId))
            .sorted(NEWEST_FIRST)
            .skip(Math.max(0, offset))
            .limit(Math.max(0, limit))
            .map(this::copy)
            .toList();
    }

    @Override
    public List<Task> findByUserIdSince(String userId, Instant since) {
        return tasks.values().stream()
            .filter(task -> task.getUserId().equals(userId))
            .filter(task -> task.getCreatedAt() != null && !task.getCreatedAt().isBefore(since))
            .sorted(NEWEST_FIRST)
            .map(this::copy)
            .toList();
    }

    @Override
    public Task updateStatus(String taskId, TaskStatus status, TaskResult result, String error) {
        Task updated = tasks.computeIfPresent(taskId, (id, current) -> {
            if (!current.getStatus().canTransitionTo(status)) {
                throw new IllegalStateException(String.format(
                    "Task %s cannot move from %s to %s", id, current.getStatus(), status));
            }
            Task next = copy(current);
            next.setStatus(status);
            next.setUpdatedAt(clock.instant());
            if (result != null) {
                next.setResult(result);
            }
            if (error != null) {
                next.setError(error);
            }
            return next;
        });
        if (updated == null) {
            throw new TaskStoreException("Unknown task: " + taskId);
        }
        log.debug("Task {} is now {}", taskId, status);
        return copy(updated);
    }

    private Task copy(Task task) {
        return task.toBuilder()
            .context(task.getContext() == null ? new HashMap<>() : new HashMap<>(task.getContext()))
            .build();
    }
}
