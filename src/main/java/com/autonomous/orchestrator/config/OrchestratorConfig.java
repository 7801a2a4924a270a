package com.autonomous.orchestrator.config;

import com.autonomous.orchestrator.service.AgentPool;
import com.autonomous.orchestrator.service.AgentRosterLoader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;

@Configuration
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Random source for the curiosity branch; tests replace it to force either outcome.
     */
    @Bean
    public DoubleSupplier curiosityRandom() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }

    @Bean
    public AgentPool agentPool(AgentRosterLoader rosterLoader,
                               @Value("${agent.roster.path:classpath:agents.yaml}") Resource roster) {
        return new AgentPool(rosterLoader.load(roster));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService knowledgeExecutor(@Value("${orchestrator.knowledge.parallelism:4}") int parallelism) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(parallelism, runnable -> {
            Thread thread = new Thread(runnable, "knowledge-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ThreadPoolTaskScheduler orchestrationScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("orchestration-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        return scheduler;
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder,
                                     @Value("${orchestrator.knowledge.http-timeout-ms:10000}") long timeoutMs) {
        return builder
            .setConnectTimeout(Duration.ofMillis(timeoutMs))
            .setReadTimeout(Duration.ofMillis(timeoutMs))
            .defaultHeader("User-Agent", "task-orchestrator/0.1")
            .build();
    }
}
