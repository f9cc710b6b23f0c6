package com.tribrid.studio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Training Studio Service - Entry point for the Spring Boot application.
 *
 * Follows the live telemetry of one training run at a time:
 * - Lists runs from the Training Control API and selects one
 * - Merges its metric history and live stream into a deduplicated pipeline
 * - Serves the telemetry buffer, run status and HUD to the studio UI
 * - Guards cancel and promote against the authoritative run status
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.tribrid.studio.config")
public class TrainingStudioApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrainingStudioApplication.class, args);
    }
}
