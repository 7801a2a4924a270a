package com.autonomous.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ContextUpdate {
    @Builder.Default
    List<String> interests = List.of();
    Instant lastInteraction;
    @Builder.Default
    int interactionCount = 1;
}
