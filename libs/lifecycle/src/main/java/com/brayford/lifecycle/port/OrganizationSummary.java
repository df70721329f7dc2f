package com.brayford.lifecycle.port;

/**
 * The slice of an organization the deletion flow needs.
 */
public record OrganizationSummary(String organizationId, String name) {
}
