package com.autonomous.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaskOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskOrchestratorApplication.class, args);
    }
}
