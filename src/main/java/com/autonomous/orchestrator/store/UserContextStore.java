package com.autonomous.orchestrator.store;

import com.autonomous.orchestrator.model.UserContext;

import java.util.Optional;
import java.util.function.UnaryOperator;

public interface UserContextStore {

    Optional<UserContext> findByUserId(String userId);

    /**
     * Applies {@code merge} to the stored context of the user (an empty one if none exists yet)
     * atomically and stores the outcome.
     */
    UserContext merge(String userId, UnaryOperator<UserContext> merge);
}
