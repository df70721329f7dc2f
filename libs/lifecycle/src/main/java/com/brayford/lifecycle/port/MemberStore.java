package com.brayford.lifecycle.port;

import com.brayford.security.OrganizationMember;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for organization memberships.
 *
 * <p>Writes are conditional on the caller's last read. Implementations must also refuse any write
 * that would leave an organization that has owners with none; such a write returns {@code false}
 * just like a lost race, and a re-read shows the caller why.
 */
public interface MemberStore {

    Optional<OrganizationMember> findById(String memberId);

    Optional<OrganizationMember> findByOrganizationAndUser(String organizationId, String userId);

    List<OrganizationMember> listByOrganization(String organizationId);

    default long countOwners(String organizationId) {
        return listByOrganization(organizationId).stream()
                .filter(OrganizationMember::isOwner)
                .count();
    }

    /**
     * @throws IllegalStateException if the member id or the (organization, user) pair is taken
     */
    void create(OrganizationMember member);

    /** Replaces {@code expected} with {@code updated} if the stored record still equals {@code expected}. */
    boolean replace(OrganizationMember expected, OrganizationMember updated);

    /** Deletes the member if the stored record still equals {@code expected}. */
    boolean delete(OrganizationMember expected);

    /** Removes every membership of the organization, returning how many were removed. */
    int deleteByOrganization(String organizationId);
}
