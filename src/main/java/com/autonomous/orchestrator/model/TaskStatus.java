package com.autonomous.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    /**
     * Tasks only move forward: pending, then processing, then a terminal state.
     * A pending task may fail outright if it cannot be picked up at all.
     */
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING || next == FAILED;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
