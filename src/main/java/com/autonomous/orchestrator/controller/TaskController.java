package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.model.SubmitTaskRequest;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.service.TaskOrchestrator;
import com.autonomous.orchestrator.store.TaskStore;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    static final String USER_HEADER = "X-User-Id";

    private final TaskOrchestrator orchestrator;
    private final TaskStore taskStore;

    public TaskController(TaskOrchestrator orchestrator, TaskStore taskStore) {
        this.orchestrator = orchestrator;
        this.taskStore = taskStore;
    }

    @PostMapping("/submit")
    public ResponseEntity<?> submit(@RequestHeader(USER_HEADER) String userId,
                                    @Valid @RequestBody SubmitTaskRequest request) {
        String taskId = orchestrator.submitTask(userId, request.getPrompt().trim(), request.getContext());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
            "success", true,
            "taskId", taskId,
            "message", "Task submitted successfully"
        ));
    }

    @GetMapping("/{taskId}/status")
    public ResponseEntity<?> status(@RequestHeader(USER_HEADER) String userId, @PathVariable String taskId) {
        Task task = taskStore.findByIdAndUserId(taskId, userId)
            .orElseThrow(() -> new TaskNotFoundException(taskId));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", task.getId());
        body.put("status", task.getStatus());
        body.put("result", task.getResult());
        body.put("error", task.getError());
        body.put("createdAt", task.getCreatedAt());
        body.put("updatedAt", task.getUpdatedAt());
        return ResponseEntity.ok(Map.of("success", true, "task", body));
    }

    @GetMapping("/history")
    public ResponseEntity<?> history(@RequestHeader(USER_HEADER) String userId,
                                     @RequestParam(defaultValue = "1") int page,
                                     @RequestParam(defaultValue = "20") int limit) {
        int safePage = Math.max(1, page);
        int safeLimit = Math.min(100, Math.max(1, limit));
        List<Map<String, Object>> tasks = taskStore.findByUserId(userId, (safePage - 1) * safeLimit, safeLimit).stream()
            .map(this::summary)
            .toList();

        return ResponseEntity.ok(Map.of(
            "success", true,
            "tasks", tasks,
            "pagination", Map.of("page", safePage, "limit", safeLimit, "total", tasks.size())
        ));
    }

    private Map<String, Object> summary(Task task) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", task.getId());
        row.put("prompt", task.getPrompt());
        row.put("status", task.getStatus());
        row.put("createdAt", task.getCreatedAt());
        row.put("updatedAt", task.getUpdatedAt());
        return row;
    }
}
