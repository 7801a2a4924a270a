package com.autonomous.orchestrator.model;

import java.util.List;

/**
 * Descriptive trait tags of an agent, e.g. curious, analytical, thorough.
 */
public record Personality(List<String> traits) {

    public Personality {
        traits = traits == null ? List.of() : List.copyOf(traits);
    }

    public static Personality of(String... traits) {
        return new Personality(List.of(traits));
    }

    public String describe() {
        return String.join(", ", traits);
    }
}
