package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserContext {
    private String userId;
    @Builder.Default
    private Set<String> interests = new LinkedHashSet<>();
    private long interactionCount;
    private Instant lastInteraction;
    @Builder.Default
    private Map<String, Object> contextData = new HashMap<>();

    public static UserContext empty(String userId) {
        return UserContext.builder().userId(userId).build();
    }
}
