package com.brayford.security;

/**
 * Enforces tenant isolation for member records.
 *
 * <p>Every membership operation is addressed to an organization. A member record loaded by id
 * must belong to that organization before any guard check runs on it.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Verifies that the member belongs to the organization being operated on.
     *
     * @param member         the member record
     * @param organizationId the organization addressed by the request
     * @throws TenantMismatchException if the organizations differ
     */
    public static void enforce(OrganizationMember member, String organizationId) {
        if (!member.organizationId().equals(organizationId)) {
            throw new TenantMismatchException(organizationId, member.organizationId());
        }
    }

    /** Whether both members belong to the same organization. */
    public static boolean sameTenant(OrganizationMember a, OrganizationMember b) {
        return a.organizationId().equals(b.organizationId());
    }
}
