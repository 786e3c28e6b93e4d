package com.agentforge.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AgentForge orchestrator: task state machine, per-stage priority queues
 * and approval checkpoints behind a REST API.
 *
 * To run:
 *   ANTHROPIC_API_KEY=sk-ant-... mvn -pl orchestrator spring-boot:run
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
