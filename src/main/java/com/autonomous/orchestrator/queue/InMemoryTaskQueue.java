package com.autonomous.orchestrator.queue;

import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;

@Slf4j
@Component
public class InMemoryTaskQueue implements TaskQueue {

    private final BlockingDeque<Task> tasks = new LinkedBlockingDeque<>();

    @Override
    public void enqueue(Task task) {
        if (task.getStatus() != TaskStatus.PENDING) {
            throw new IllegalArgumentException("Only pending tasks can be queued, got " + task.getStatus());
        }
        if (!tasks.offerLast(task)) {
            throw new TaskQueueException("Queue rejected task " + task.getId());
        }
        log.debug("Queued task {} (depth={})", task.getId(), tasks.size());
    }

    @Override
    public Optional<Task> dequeue() {
        return Optional.ofNullable(tasks.pollFirst());
    }

    @Override
    public void requeue(Task task) {
        if (!tasks.offerFirst(task)) {
            throw new TaskQueueException("Queue rejected deferred task " + task.getId());
        }
    }

    @Override
    public int size() {
        return tasks.size();
    }
}
