package com.autonomous.orchestrator.service;

/**
 * Produces a completion for a prompt. Blocking from the caller's point of view.
 */
@FunctionalInterface
public interface TextGenerator {

    /**
     * @param modelHint preferred model, or {@code null} for the configured default
     * @throws TextGenerationException when no completion could be produced
     */
    String generate(String prompt, String systemInstructions, String modelHint);
}
