package com.autonomous.orchestrator.store;

import com.autonomous.orchestrator.model.UserContext;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Repository
public class InMemoryUserContextStore implements UserContextStore {

    private final Map<String, UserContext> contexts = new ConcurrentHashMap<>();

    @Override
    public Optional<UserContext> findByUserId(String userId) {
        return Optional.ofNullable(contexts.get(userId)).map(this::copy);
    }

    @Override
    public UserContext merge(String userId, UnaryOperator<UserContext> merge) {
        UserContext merged = contexts.compute(userId, (id, current) ->
            copy(merge.apply(current == null ? UserContext.empty(id) : copy(current))));
        return copy(merged);
    }

    private UserContext copy(UserContext context) {
        return context.toBuilder()
            .interests(new LinkedHashSet<>(context.getInterests()))
            .contextData(new HashMap<>(context.getContextData()))
            .build();
    }
}
