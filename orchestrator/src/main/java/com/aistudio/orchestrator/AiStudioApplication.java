package com.aistudio.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Background job layer of the AI studio: agents, workflows and
 * human-in-the-loop jobs behind a REST API.
 *
 * To run:
 *   AI_STUDIO_TEXT_API_KEY=sk-ant-... mvn spring-boot:run -pl orchestrator
 */
@SpringBootApplication
public class AiStudioApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiStudioApplication.class, args);
    }
}
