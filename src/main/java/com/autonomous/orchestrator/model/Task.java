package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Task {
    private String id;
    private String userId;
    private String prompt;
    @Builder.Default
    private Map<String, Object> context = new HashMap<>();
    @Builder.Default
    private int priority = 1;  // stored, not used for ordering
    private TaskStatus status;
    private Instant createdAt;
    private Instant updatedAt;
    private TaskResult result;
    private String error;
}
