package com.brayford.organization.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code brayford.service.*}.
 *
 * <pre>
 * brayford:
 *   service:
 *     name: organization-service
 *     environment: production
 *     description: Organization membership and deletion lifecycle
 *     app-url: https://app.brayford.events
 * </pre>
 *
 * @param name        service name used in logs and as the metrics service tag; required
 * @param environment deployment environment (development, staging, production)
 * @param description human-readable description for the info endpoint
 * @param appUrl      base URL of the web app that hosts the confirm and undo pages; required
 */
@ConfigurationProperties(prefix = "brayford.service")
@Validated
public record OrganizationServiceProperties(
        @NotBlank String name, String environment, String description, @NotBlank String appUrl) {

    /** Applies defaults for optional fields before Bean Validation runs. */
    public OrganizationServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
