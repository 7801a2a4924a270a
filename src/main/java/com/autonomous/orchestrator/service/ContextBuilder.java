package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.ContextUpdate;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.UserContext;
import com.autonomous.orchestrator.store.TaskStore;
import com.autonomous.orchestrator.store.UserContextStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Assembles and updates the per-user context used to personalize task processing.
 */
@Service
public class ContextBuilder {

    static final String RECENT_PROMPTS = "recentPrompts";
    static final String CURRENT_PROMPT = "currentPrompt";

    private final UserContextStore contextStore;
    private final TaskStore taskStore;
    private final int recentPromptLimit;

    public ContextBuilder(UserContextStore contextStore,
                          TaskStore taskStore,
                          @Value("${orchestrator.context.recent-prompts:5}") int recentPromptLimit) {
        this.contextStore = contextStore;
        this.taskStore = taskStore;
        this.recentPromptLimit = recentPromptLimit;
    }

    public UserContext buildContext(String userId, String prompt) {
        UserContext context = contextStore.findByUserId(userId).orElseGet(() -> UserContext.empty(userId));

        // only finished tasks count as previous interactions
        List<String> recentPrompts = taskStore.findByUserId(userId, 0, recentPromptLimit * 2).stream()
            .filter(task -> task.getStatus() != null && task.getStatus().isTerminal())
            .map(Task::getPrompt)
            .filter(Objects::nonNull)
            .limit(recentPromptLimit)
            .toList();

        context.getContextData().put(RECENT_PROMPTS, recentPrompts);
        context.getContextData().put(CURRENT_PROMPT, prompt);
        return context;
    }

    /**
     * Adds newly observed interests and bumps the interaction count. Never removes interests
     * and never lowers the count.
     */
    public UserContext updateUserContext(String userId, ContextUpdate update) {
        return contextStore.merge(userId, current -> {
            update.getInterests().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(interest -> !interest.isEmpty())
                .forEach(current.getInterests()::add);
            current.setInteractionCount(current.getInteractionCount() + Math.max(0, update.getInteractionCount()));
            current.setLastInteraction(latest(current.getLastInteraction(), update.getLastInteraction()));
            return current;
        });
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
