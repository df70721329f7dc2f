package com.brayford.organization;

import com.brayford.organization.config.DeletionProperties;
import com.brayford.organization.config.OrganizationServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Brayford organization service: member administration and the organization deletion flow.
 *
 * <p>Storage, email and the completion trigger are in-process adapters, so the service runs with
 * no external infrastructure.
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health and metrics endpoints
 *   <li>Correlation ID propagation into the SLF4J MDC
 *   <li>RFC 7807 ProblemDetail error bodies
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({OrganizationServiceProperties.class, DeletionProperties.class})
public class OrganizationServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(OrganizationServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(OrganizationServiceApplication.class, args);
        log.info("Brayford organization service started");
    }
}
