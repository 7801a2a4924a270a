package com.autonomous.orchestrator.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Drives {@link TaskOrchestrator#processNext()} at a fixed delay. {@link #stop()} cancels the
 * schedule; a failing tick is logged and the next one runs as usual.
 */
@Slf4j
@Component
public class OrchestrationLoop implements SmartLifecycle {

    private final TaskOrchestrator orchestrator;
    private final TaskScheduler scheduler;
    private final Duration interval;
    private final boolean enabled;

    private volatile ScheduledFuture<?> schedule;

    public OrchestrationLoop(TaskOrchestrator orchestrator,
                             @Qualifier("orchestrationScheduler") TaskScheduler scheduler,
                             @Value("${orchestrator.loop.interval-ms:1000}") long intervalMs,
                             @Value("${orchestrator.loop.enabled:true}") boolean enabled) {
        this.orchestrator = orchestrator;
        this.scheduler = scheduler;
        this.interval = Duration.ofMillis(intervalMs);
        this.enabled = enabled;
    }

    @Override
    public synchronized void start() {
        if (!enabled) {
            log.info("Processing loop disabled");
            return;
        }
        if (schedule == null) {
            schedule = scheduler.scheduleWithFixedDelay(this::tick, interval);
            log.info("Processing loop started, interval {} ms", interval.toMillis());
        }
    }

    @Override
    public synchronized void stop() {
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
            log.info("Processing loop stopped");
        }
    }

    @Override
    public boolean isRunning() {
        ScheduledFuture<?> current = schedule;
        return current != null && !current.isCancelled();
    }

    void tick() {
        try {
            orchestrator.processNext();
        } catch (RuntimeException e) {
            log.error("Error in processing loop", e);
        }
    }
}
