package com.brayford.lifecycle.port;

import java.util.Optional;

/**
 * Read access to organizations and users, plus removal of an organization once it is purged.
 */
public interface TenantDirectory {

    Optional<OrganizationSummary> findOrganization(String organizationId);

    Optional<UserProfile> findUser(String userId);

    /** Removes the organization record. Returns false if it was already gone. */
    boolean removeOrganization(String organizationId);
}
