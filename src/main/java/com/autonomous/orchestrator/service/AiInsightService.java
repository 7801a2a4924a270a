package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.SourceRecord;
import com.autonomous.orchestrator.model.UserContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Domain prompts on top of the raw {@link TextGenerator}: concept, interest and topic extraction,
 * multi-source synthesis, insights and the final task response.
 * <p>
 * Extraction calls degrade to an empty answer when the model fails or returns something that
 * is not a JSON array; synthesis, insights and responses propagate the failure.
 */
@Slf4j
@Service
public class AiInsightService {

    private static final String JSON_ONLY = "Return only valid JSON.";

    private final TextGenerator textGenerator;
    private final ObjectMapper objectMapper;
    private final String defaultModel;
    private final String fastModel;

    public AiInsightService(TextGenerator textGenerator,
                            ObjectMapper objectMapper,
                            @Value("${llm.default-model:gpt-4o}") String defaultModel,
                            @Value("${llm.fast-model:gpt-4o-mini}") String fastModel) {
        this.textGenerator = textGenerator;
        this.objectMapper = objectMapper;
        this.defaultModel = defaultModel;
        this.fastModel = fastModel;
    }

    public List<String> extractConcepts(String text) {
        String prompt = String.format(
            "Extract the main concepts and topics from this text. Return only a JSON array of strings: \"%s\"", text);
        return extractList("Concept extraction", prompt, "You are a concept extraction expert. " + JSON_ONLY);
    }

    public List<String> extractInterests(String userPrompt, String response) {
        String prompt = String.format(
            "Based on this user prompt and AI response, extract the user's interests and preferences. "
                + "Return a JSON array of strings.%n%nUser Prompt: %s%nAI Response: %s", userPrompt, response);
        return extractList("Interest extraction", prompt, "You are an interest analysis expert. " + JSON_ONLY);
    }

    public List<String> extractRelatedTopics(String content) {
        String prompt = String.format(
            "Extract related topics and concepts from this content. Return a JSON array of strings: \"%s\"", content);
        return extractList("Related topics extraction", prompt, "You are a topic extraction expert. " + JSON_ONLY);
    }

    public String extractMainTopic(String query) {
        String prompt = String.format(
            "What is the main topic or subject of this query? Return only the topic name: \"%s\"", query);
        try {
            String topic = textGenerator.generate(prompt, "You are a topic identification expert.", fastModel).trim();
            return topic.isEmpty() ? query : topic;
        } catch (RuntimeException e) {
            log.error("Main topic extraction failed for \"{}\": {}", query, e.getMessage());
            return query;
        }
    }

    public String synthesizeInformation(String query, List<SourceRecord> sources) {
        String numbered = IntStream.range(0, sources.size())
            .mapToObj(i -> String.format("%d. %s: %s", i + 1, sources.get(i).getTitle(), sources.get(i).getContent()))
            .collect(Collectors.joining("\n\n"));
        String prompt = String.format(
            "Synthesize information from multiple sources to answer this query: \"%s\"%n%n"
                + "Sources:%n%s%n%n"
                + "Provide a comprehensive, well-structured response that combines insights from all sources.",
            query, numbered);
        return textGenerator.generate(prompt,
            "You are an expert information synthesizer. Provide accurate, comprehensive responses.", defaultModel);
    }

    public String generateInsights(String topic) {
        String prompt = String.format(
            "Provide deep insights and analysis about: %s. "
                + "Include current trends, implications, and connections to other fields.", topic);
        return textGenerator.generate(prompt,
            "You are an expert analyst providing deep insights on various topics.", defaultModel);
    }

    public String generateResponse(String prompt, UserContext context) {
        return textGenerator.generate(prompt, buildSystemPrompt(context), defaultModel);
    }

    String buildSystemPrompt(UserContext context) {
        StringBuilder system = new StringBuilder(
            "You are an advanced AI assistant with autonomous learning capabilities. "
                + "You are curious, thorough, and always seeking to expand knowledge.");
        if (context != null && !context.getInterests().isEmpty()) {
            system.append(" The user is interested in: ").append(String.join(", ", context.getInterests())).append('.');
        }
        if (context != null && context.getInteractionCount() > 0) {
            system.append(" Consider the user's previous interactions and build upon that context.");
        }
        system.append(" Always provide comprehensive, accurate, and insightful responses.");
        return system.toString();
    }

    private List<String> extractList(String what, String prompt, String system) {
        try {
            String raw = textGenerator.generate(prompt, system, fastModel);
            return parseStringArray(raw);
        } catch (RuntimeException | JsonProcessingException e) {
            log.error("{} failed: {}", what, e.getMessage());
            return List.of();
        }
    }

    List<String> parseStringArray(String raw) throws JsonProcessingException {
        String json = stripCodeFence(raw == null ? "" : raw.trim());
        List<String> values = objectMapper.readValue(json, new TypeReference<List<String>>() {});
        return values.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .distinct()
            .toList();
    }

    private static String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, closing).trim();
    }
}
