package com.conduit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for Conduit - a multi-provider LLM gateway with caching,
 * routing, resilience and budget enforcement.
 */
@SpringBootApplication
@EnableScheduling
public class ConduitApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConduitApplication.class, args);
    }
}
