package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.knowledge.KnowledgeSeeker;
import com.autonomous.orchestrator.model.Agent;
import com.autonomous.orchestrator.model.AgentStatusSnapshot;
import com.autonomous.orchestrator.model.ContextUpdate;
import com.autonomous.orchestrator.model.KnowledgeItem;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskResult;
import com.autonomous.orchestrator.model.TaskStatus;
import com.autonomous.orchestrator.model.UserContext;
import com.autonomous.orchestrator.notification.NotificationService;
import com.autonomous.orchestrator.queue.TaskQueue;
import com.autonomous.orchestrator.store.TaskStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.DoubleSupplier;

/**
 * Sequences one processing attempt: dequeue, select an agent, build context, gather knowledge,
 * optionally explore out of curiosity, produce the result, persist, notify, release.
 */
@Slf4j
@Service
public class TaskOrchestrator {

    public enum TickOutcome {
        /** Nothing was queued. */
        IDLE,
        /** No agent was free; the task went back to the head of the queue. */
        DEFERRED,
        COMPLETED,
        FAILED
    }

    private final TaskQueue taskQueue;
    private final TaskStore taskStore;
    private final AgentPool agentPool;
    private final AgentSelector agentSelector;
    private final ContextBuilder contextBuilder;
    private final KnowledgeSeeker knowledgeSeeker;
    private final AiInsightService aiInsightService;
    private final TaskProcessor taskProcessor;
    private final NotificationService notificationService;
    private final DoubleSupplier curiosityRandom;
    private final Clock clock;

    public TaskOrchestrator(TaskQueue taskQueue,
                            TaskStore taskStore,
                            AgentPool agentPool,
                            AgentSelector agentSelector,
                            ContextBuilder contextBuilder,
                            KnowledgeSeeker knowledgeSeeker,
                            AiInsightService aiInsightService,
                            TaskProcessor taskProcessor,
                            NotificationService notificationService,
                            @Qualifier("curiosityRandom") DoubleSupplier curiosityRandom,
                            Clock clock) {
        this.taskQueue = taskQueue;
        this.taskStore = taskStore;
        this.agentPool = agentPool;
        this.agentSelector = agentSelector;
        this.contextBuilder = contextBuilder;
        this.knowledgeSeeker = knowledgeSeeker;
        this.aiInsightService = aiInsightService;
        this.taskProcessor = taskProcessor;
        this.notificationService = notificationService;
        this.curiosityRandom = curiosityRandom;
        this.clock = clock;
    }

    /**
     * Records a pending task and queues it. Does not wait for processing.
     */
    public String submitTask(String userId, String prompt, Map<String, Object> context) {
        Instant now = clock.instant();
        Task task = Task.builder()
            .id(newTaskId())
            .userId(userId)
            .prompt(prompt)
            .context(context == null ? new HashMap<>() : new HashMap<>(context))
            .status(TaskStatus.PENDING)
            .createdAt(now)
            .updatedAt(now)
            .build();

        taskStore.save(task);
        try {
            taskQueue.enqueue(task);
        } catch (RuntimeException e) {
            log.error("Could not queue task {} of user {}", task.getId(), userId, e);
            markFailed(task, "enqueue", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            throw e;
        }
        log.info("Task {} submitted by user {}", task.getId(), userId);
        return task.getId();
    }

    public List<AgentStatusSnapshot> getAgentStatus() {
        return agentPool.snapshot();
    }

    /**
     * One cycle of the processing loop. Queue and store outages propagate to the caller.
     */
    public TickOutcome processNext() {
        Optional<Task> next = taskQueue.dequeue();
        if (next.isEmpty()) {
            return TickOutcome.IDLE;
        }
        Task task = next.get();

        Optional<Agent> selected = agentSelector.selectAgent(task);
        if (selected.isEmpty()) {
            log.debug("No agent available for task {}, deferring", task.getId());
            taskQueue.requeue(task);
            return TickOutcome.DEFERRED;
        }

        return processTask(task, selected.get());
    }

    TickOutcome processTask(Task task, Agent agent) {
        String stage = "start";
        try {
            stage = "persist";
            taskStore.updateStatus(task.getId(), TaskStatus.PROCESSING, null, null);
            log.info("Task {} of user {} assigned to agent {}", task.getId(), task.getUserId(), agent.getName());

            stage = "context";
            UserContext context = contextBuilder.buildContext(task.getUserId(), task.getPrompt());

            stage = "queries";
            List<String> queries = generateKnowledgeQueries(task.getPrompt(), context);

            stage = "knowledge";
            List<KnowledgeItem> gathered = knowledgeSeeker.seekKnowledge(queries);
            updateAgentKnowledge(agent, gathered);

            stage = "curiosity";
            exploreIfCurious(agent, gathered);

            stage = "process";
            TaskResult result = taskProcessor.processTask(task, context, gathered, agent);

            stage = "persist";
            taskStore.updateStatus(task.getId(), TaskStatus.COMPLETED, result, null);
            updateUserContext(task, result);

            stage = "notify";
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("taskId", task.getId());
            event.put("status", TaskStatus.COMPLETED.wireName());
            event.put("result", result);
            event.put("agent", agent.getName());
            notificationService.publish(task.getUserId(), NotificationService.TASK_PROGRESS, event);

            log.info("Task {} completed by agent {}", task.getId(), agent.getName());
            return TickOutcome.COMPLETED;
        } catch (RuntimeException e) {
            log.error("Error processing task {} (user={}, agent={}, stage={})",
                task.getId(), task.getUserId(), agent.getId(), stage, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            markFailed(task, stage, message);

            Map<String, Object> event = new LinkedHashMap<>();
            event.put("taskId", task.getId());
            event.put("error", message);
            notificationService.publish(task.getUserId(), NotificationService.TASK_ERROR, event);
            return TickOutcome.FAILED;
        } finally {
            agent.release();
        }
    }

    List<String> generateKnowledgeQueries(String prompt, UserContext context) {
        List<String> concepts = aiInsightService.extractConcepts(prompt);
        String interests = String.join(", ", context.getInterests());

        List<String> queries = new ArrayList<>();
        for (String concept : concepts) {
            queries.add(String.format("What is %s?", concept));
            queries.add(String.format("How does %s relate to %s?", concept, interests));
            queries.add(String.format("Latest developments in %s", concept));
        }
        return queries;
    }

    private void updateAgentKnowledge(Agent agent, List<KnowledgeItem> knowledge) {
        Instant now = clock.instant();
        knowledge.forEach(item -> agent.learn(item, now));
    }

    /**
     * With probability equal to the agent's curiosity level, follows up on every freshly
     * ingested item before the task itself is answered.
     */
    private void exploreIfCurious(Agent agent, List<KnowledgeItem> recentKnowledge) {
        if (curiosityRandom.getAsDouble() >= agent.getCuriosityLevel() || recentKnowledge.isEmpty()) {
            return;
        }
        agent.startLearning();
        try {
            List<String> followUps = recentKnowledge.stream()
                .map(item -> String.format("Tell me more about %s and its implications", item.key()))
                .toList();
            List<KnowledgeItem> additional = knowledgeSeeker.seekKnowledge(followUps);
            updateAgentKnowledge(agent, additional);
            log.info("Agent {} completed curious exploration ({} new items)", agent.getName(), additional.size());
        } finally {
            agent.finishLearning();
        }
    }

    private void updateUserContext(Task task, TaskResult result) {
        try {
            List<String> interests = aiInsightService.extractInterests(task.getPrompt(), result.getContent());
            contextBuilder.updateUserContext(task.getUserId(), ContextUpdate.builder()
                .interests(interests)
                .lastInteraction(clock.instant())
                .build());
        } catch (RuntimeException e) {
            // the task already completed, so this does not fail it
            log.warn("Could not update context of user {} after task {}: {}",
                task.getUserId(), task.getId(), e.getMessage());
        }
    }

    private void markFailed(Task task, String stage, String message) {
        try {
            taskStore.updateStatus(task.getId(), TaskStatus.FAILED, null, stage + ": " + message);
        } catch (RuntimeException e) {
            log.error("Could not mark task {} failed: {}", task.getId(), e.getMessage());
        }
    }

    private String newTaskId() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 9);
        return "task-" + clock.millis() + "-" + suffix;
    }
}
