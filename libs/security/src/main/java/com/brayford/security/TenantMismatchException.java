package com.brayford.security;

/**
 * Thrown when a member record is used against an organization it does not belong to.
 */
public class TenantMismatchException extends BrayfordException {

    public static final String CODE = "tenant-mismatch";

    private final String expectedOrganizationId;
    private final String actualOrganizationId;

    public TenantMismatchException(String expectedOrganizationId, String actualOrganizationId) {
        super("Tenant mismatch: organization '%s' cannot act on a member of organization '%s'"
                .formatted(expectedOrganizationId, actualOrganizationId));
        this.expectedOrganizationId = expectedOrganizationId;
        this.actualOrganizationId = actualOrganizationId;
    }

    public String expectedOrganizationId() {
        return expectedOrganizationId;
    }

    public String actualOrganizationId() {
        return actualOrganizationId;
    }

    @Override
    public String errorCode() {
        return CODE;
    }
}
