package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskMetrics;
import com.autonomous.orchestrator.model.TaskStatus;
import com.autonomous.orchestrator.store.TaskStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Per-user completion statistics over the last thirty days.
 */
@Service
public class TaskMetricsService {

    static final Duration WINDOW = Duration.ofDays(30);

    private final TaskStore taskStore;
    private final Clock clock;

    public TaskMetricsService(TaskStore taskStore, Clock clock) {
        this.taskStore = taskStore;
        this.clock = clock;
    }

    public TaskMetrics metricsFor(String userId) {
        Instant since = clock.instant().minus(WINDOW);
        List<Task> tasks = taskStore.findByUserIdSince(userId, since);

        long total = tasks.size();
        long completed = countWithStatus(tasks, TaskStatus.COMPLETED);
        long failed = countWithStatus(tasks, TaskStatus.FAILED);

        double avgSeconds = tasks.stream()
            .filter(task -> task.getCreatedAt() != null && task.getUpdatedAt() != null)
            .mapToDouble(task -> Duration.between(task.getCreatedAt(), task.getUpdatedAt()).toMillis() / 1000.0)
            .average()
            .orElse(0.0);

        return TaskMetrics.builder()
            .totalTasks(total)
            .completedTasks(completed)
            .failedTasks(failed)
            .successRate(total > 0 ? format((completed * 100.0) / total) : "0")
            .avgProcessingTime(format(avgSeconds))
            .build();
    }

    private static long countWithStatus(List<Task> tasks, TaskStatus status) {
        return tasks.stream().map(Task::getStatus).filter(Objects::nonNull).filter(status::equals).count();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
