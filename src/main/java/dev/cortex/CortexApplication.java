package dev.cortex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Cortex context store.
 *
 * <p>Serves the REST API under {@code /api} and the MCP tools over SSE on the same port.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CortexApplication {
    public static void main(String[] args) {
        SpringApplication.run(CortexApplication.class, args);
    }
}
