package com.autonomous.orchestrator.service;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class OrchestrationLoopTest {

    private final TaskOrchestrator orchestrator = mock(TaskOrchestrator.class);
    private final TaskScheduler scheduler = mock(TaskScheduler.class);

    @Test
    void shouldKeepRunningAfterFailingTick() {
        when(orchestrator.processNext())
            .thenThrow(new IllegalStateException("queue unavailable"))
            .thenReturn(TaskOrchestrator.TickOutcome.IDLE);
        OrchestrationLoop loop = new OrchestrationLoop(orchestrator, scheduler, 100, true);

        assertDoesNotThrow(loop::tick);
        assertDoesNotThrow(loop::tick);
        verify(orchestrator, times(2)).processNext();
    }

    @Test
    void shouldScheduleAndCancel() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMillis(250)));
        OrchestrationLoop loop = new OrchestrationLoop(orchestrator, scheduler, 250, true);

        loop.start();
        loop.start();
        assertTrue(loop.isRunning());
        verify(scheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));

        loop.stop();
        assertFalse(loop.isRunning());
        verify(future).cancel(false);
    }

    @Test
    void shouldNotScheduleWhenDisabled() {
        OrchestrationLoop loop = new OrchestrationLoop(orchestrator, scheduler, 250, false);

        loop.start();

        assertFalse(loop.isRunning());
        verifyNoInteractions(scheduler);
    }
}
