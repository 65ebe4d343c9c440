package com.devmanager.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Dev Manager orchestrator.
 *
 * To run:
 *   ANTHROPIC_API_KEY=sk-ant-... mvn -pl orchestrator spring-boot:run
 *
 * Then register a project and drive it over HTTP, e.g.
 *   curl -X POST localhost:8080/projects -H 'Content-Type: application/json' \
 *     -d '{"name":"demo","workspaceRootPath":"/path/to/repo","overallGoal":"Add a CLI flag"}'
 *   curl -X POST localhost:8080/engine/project -H 'Content-Type: application/json' -d '{"name":"demo"}'
 *   curl -X POST localhost:8080/engine/start
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
