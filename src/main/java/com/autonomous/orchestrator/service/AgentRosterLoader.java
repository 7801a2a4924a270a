package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.AgentConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads the static agent roster (name, personality, specialization, curiosity, learning rate).
 */
@Slf4j
@Service
public class AgentRosterLoader {

    private final ObjectMapper yamlMapper;

    public AgentRosterLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public List<AgentConfig> load(Resource roster) {
        if (!roster.exists()) {
            throw new IllegalStateException("Agent roster not found: " + roster.getDescription());
        }
        try (InputStream in = roster.getInputStream()) {
            List<AgentConfig> configs = yamlMapper.readValue(in, new TypeReference<List<AgentConfig>>() {});
            configs.forEach(this::validate);
            log.info("Loaded {} agent definitions from {}", configs.size(), roster.getDescription());
            return configs;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read agent roster " + roster.getDescription(), e);
        }
    }

    private void validate(AgentConfig config) {
        if (config.getName() == null || config.getName().isBlank()) {
            throw new IllegalStateException("Agent definition without a name");
        }
        checkUnitInterval(config.getName(), "curiosity_level", config.getCuriosityLevel());
        checkUnitInterval(config.getName(), "learning_rate", config.getLearningRate());
    }

    private void checkUnitInterval(String agent, String field, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalStateException(String.format("%s of agent %s must be in [0,1], got %s", field, agent, value));
        }
    }
}
