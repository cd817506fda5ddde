package com.project.agro.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the Spring Boot context that hosts the analysis engine. Bootstrapping only,
 * no business logic here.
 *
 * @SpringBootApplication triggers component scanning of the imaging and service packages and
 * binds the app.analysis.* defaults.
 */
@SpringBootApplication
public class Application {
    public static void main(String[] args) {
        // No web server: callers use AerialAnalysisService from their own threads.
        SpringApplication.run(Application.class, args);
    }
}
