package com.brayford.security;

/**
 * A brand-scope check failed: the member may not touch resources of the given brand.
 */
public class AccessDeniedException extends BrayfordException {

    public static final String CODE = "access-denied";

    private final OrganizationRole role;
    private final String brandId;

    public AccessDeniedException(OrganizationRole role, String brandId) {
        super("Access denied: %s does not have access to brand %s".formatted(role.value(), brandId));
        this.role = role;
        this.brandId = brandId;
    }

    public OrganizationRole role() {
        return role;
    }

    public String brandId() {
        return brandId;
    }

    @Override
    public String errorCode() {
        return CODE;
    }
}
