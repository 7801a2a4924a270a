package com.autonomous.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentStatus {
    IDLE,
    BUSY,
    LEARNING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
