package com.autonomous.orchestrator.store;

import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskResult;
import com.autonomous.orchestrator.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTaskStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private InMemoryTaskStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTaskStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldWalkThroughLifecycle() {
        store.save(task("task-1", "u1", NOW.minusSeconds(10)));

        store.updateStatus("task-1", TaskStatus.PROCESSING, null, null);
        TaskResult result = TaskResult.builder().content("done").build();
        Task completed = store.updateStatus("task-1", TaskStatus.COMPLETED, result, null);

        assertEquals(TaskStatus.COMPLETED, completed.getStatus());
        assertEquals("done", completed.getResult().getContent());
        assertEquals(NOW, completed.getUpdatedAt());
    }

    @Test
    void shouldRejectBackwardTransition() {
        store.save(task("task-1", "u1", NOW));
        store.updateStatus("task-1", TaskStatus.PROCESSING, null, null);
        store.updateStatus("task-1", TaskStatus.FAILED, null, "process: boom");

        assertThrows(IllegalStateException.class,
            () -> store.updateStatus("task-1", TaskStatus.PENDING, null, null));
        assertEquals(TaskStatus.FAILED, store.findById("task-1").orElseThrow().getStatus());
        assertEquals("process: boom", store.findById("task-1").orElseThrow().getError());
    }

    @Test
    void shouldFailForUnknownTask() {
        assertThrows(TaskStoreException.class,
            () -> store.updateStatus("missing", TaskStatus.PROCESSING, null, null));
    }

    @Test
    void shouldReturnCopies() {
        store.save(task("task-1", "u1", NOW));

        Task copy = store.findById("task-1").orElseThrow();
        copy.setStatus(TaskStatus.COMPLETED);
        copy.getContext().put("tampered", true);

        Task stored = store.findById("task-1").orElseThrow();
        assertEquals(TaskStatus.PENDING, stored.getStatus());
        assertFalse(stored.getContext().containsKey("tampered"));
    }

    @Test
    void shouldListUserHistoryNewestFirst() {
        store.save(task("old", "u1", NOW.minusSeconds(300)));
        store.save(task("new", "u1", NOW.minusSeconds(10)));
        store.save(task("mid", "u1", NOW.minusSeconds(100)));
        store.save(task("other", "u2", NOW));

        List<Task> firstPage = store.findByUserId("u1", 0, 2);
        List<Task> secondPage = store.findByUserId("u1", 2, 2);

        assertEquals(List.of("new", "mid"), firstPage.stream().map(Task::getId).toList());
        assertEquals(List.of("old"), secondPage.stream().map(Task::getId).toList());
    }

    @Test
    void shouldScopeLookupToOwner() {
        store.save(task("task-1", "u1", NOW));

        assertTrue(store.findByIdAndUserId("task-1", "u1").isPresent());
        assertTrue(store.findByIdAndUserId("task-1", "u2").isEmpty());
    }

    private Task task(String id, String userId, Instant createdAt) {
        return Task.builder()
            .id(id)
            .userId(userId)
            .prompt("prompt " + id)
            .status(TaskStatus.PENDING)
            .createdAt(createdAt)
            .updatedAt(createdAt)
            .build();
    }
}
