package io.agentkeep;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AgentKeep: durable checkpoints, resumable plan execution and tiered memory for agents,
 * backed by SQLite with JobRunr handling retention.
 */
@SpringBootApplication
public class AgentKeepApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentKeepApplication.class, args);
    }
}
