package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.Agent;
import com.autonomous.orchestrator.model.KnowledgeEntry;
import com.autonomous.orchestrator.model.KnowledgeItem;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskResult;
import com.autonomous.orchestrator.model.UserContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a task plus everything gathered for it into the final result.
 */
@Slf4j
@Service
public class TaskProcessor {

    static final int MAX_CONTENT_CHARS = 800;
    static final int MAX_BACKGROUND_ENTRIES = 5;

    private final AiInsightService aiInsightService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TaskProcessor(AiInsightService aiInsightService, ObjectMapper objectMapper, Clock clock) {
        this.aiInsightService = aiInsightService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public TaskResult processTask(Task task, UserContext context, List<KnowledgeItem> knowledge, Agent agent) {
        String prompt = buildPrompt(task, context, knowledge, agent);
        String content = aiInsightService.generateResponse(prompt, context);
        if (content == null || content.isBlank()) {
            throw new TextGenerationException("Empty response for task " + task.getId());
        }

        return TaskResult.builder()
            .content(content)
            .agentId(agent.getId())
            .agentName(agent.getName())
            .knowledgeTopics(knowledge.stream().map(KnowledgeItem::key).distinct().toList())
            .knowledgeConfidence(averageConfidence(knowledge))
            .generatedAt(clock.instant())
            .build();
    }

    String buildPrompt(Task task, UserContext context, List<KnowledgeItem> knowledge, Agent agent) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("User request: ").append(task.getPrompt()).append("\n\n");

        if (task.getContext() != null && !task.getContext().isEmpty()) {
            prompt.append("Additional context: ").append(toJson(task.getContext())).append("\n\n");
        }

        List<String> recentPrompts = recentPrompts(context);
        if (!recentPrompts.isEmpty()) {
            prompt.append("Previous requests from this user:\n");
            recentPrompts.forEach(previous -> prompt.append("- ").append(previous).append('\n'));
            prompt.append('\n');
        }

        prompt.append(String.format("You are %s (%s), specialized in %s.%n%n",
            agent.getName(), agent.getPersonality().describe(), String.join(", ", agent.getSpecialization())));

        if (!knowledge.isEmpty()) {
            prompt.append("Relevant knowledge gathered for this request:\n");
            for (KnowledgeItem item : knowledge) {
                prompt.append(String.format(Locale.ROOT, "- %s (confidence %.2f): %s%n",
                    item.key(), item.getConfidence() == null ? KnowledgeEntry.DEFAULT_CONFIDENCE : item.getConfidence(),
                    truncate(item.getContent())));
            }
            prompt.append('\n');
        }

        Set<String> gathered = knowledge.stream().map(KnowledgeItem::key).collect(Collectors.toSet());
        List<KnowledgeEntry> background = agent.getKnowledgeBase().entrySet().stream()
            .filter(entry -> !gathered.contains(entry.getKey()))
            .map(Map.Entry::getValue)
            .sorted(Comparator.comparingDouble(KnowledgeEntry::getConfidence).reversed())
            .limit(MAX_BACKGROUND_ENTRIES)
            .toList();
        if (!background.isEmpty()) {
            prompt.append("Background knowledge you already hold:\n");
            background.forEach(entry -> prompt.append(String.format("- %s: %s%n",
                entry.getItem().key(), truncate(entry.getItem().getContent()))));
            prompt.append('\n');
        }

        prompt.append("Answer the user request using this knowledge where it helps.");
        return prompt.toString();
    }

    private static List<String> recentPrompts(UserContext context) {
        if (context == null || !(context.getContextData().get(ContextBuilder.RECENT_PROMPTS) instanceof List<?> prompts)) {
            return List.of();
        }
        return prompts.stream().filter(Objects::nonNull).map(String::valueOf).toList();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize task context: {}", e.getMessage());
            return String.valueOf(value);
        }
    }

    private static double averageConfidence(List<KnowledgeItem> knowledge) {
        return knowledge.stream()
            .mapToDouble(item -> item.getConfidence() == null ? KnowledgeEntry.DEFAULT_CONFIDENCE : item.getConfidence())
            .average()
            .orElse(0.0);
    }

    private static String truncate(String text) {
        if (text == null) return "";
        return text.length() <= MAX_CONTENT_CHARS ? text : text.substring(0, MAX_CONTENT_CHARS) + "...";
    }
}
