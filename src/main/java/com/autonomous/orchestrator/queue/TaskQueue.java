package com.autonomous.orchestrator.queue;

import com.autonomous.orchestrator.model.Task;

import java.util.Optional;

/**
 * Ordered holding area for tasks awaiting processing. Delivery is FIFO by enqueue time and
 * at-most-once: a dequeued task is never handed to a second caller.
 */
public interface TaskQueue {

    void enqueue(Task task);

    Optional<Task> dequeue();

    /**
     * Returns a task that could not be processed this cycle to the head of the queue.
     */
    void requeue(Task task);

    int size();
}
