package com.judgmentbell.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExperimentOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExperimentOrchestratorApplication.class, args);
    }
}
