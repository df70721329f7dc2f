package com.brayford.security;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A user's membership in one organization.
 *
 * <p>Two onboarding flows produce members: a user who creates an organization becomes its owner
 * with no invitation provenance ({@link #founder}), and a user who joins an existing organization
 * carries who invited them and when ({@link #invited}).
 *
 * @param memberId       unique id of this membership record
 * @param organizationId the organization (tenant) this membership belongs to
 * @param userId         the member's user id
 * @param role           role within the organization
 * @param permissions    custom capability override; null means "derive from role"
 * @param brandAccess    brand ids a MEMBER-role user may access (ignored for owners and admins)
 * @param invitedBy      user id of the inviter, null for a self-created organization
 * @param invitedAt      when the invitation was sent, null for a self-created organization
 * @param joinedAt       when the user joined
 */
public record OrganizationMember(
        String memberId,
        String organizationId,
        String userId,
        OrganizationRole role,
        List<Capability> permissions,
        List<String> brandAccess,
        String invitedBy,
        Instant invitedAt,
        Instant joinedAt) {

    public OrganizationMember {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        if (joinedAt == null) {
            throw new IllegalArgumentException("joinedAt must not be null");
        }
        if ((invitedBy == null) != (invitedAt == null)) {
            throw new IllegalArgumentException("invitedBy and invitedAt must both be set or both be null");
        }
        permissions = permissions == null ? null : List.copyOf(permissions);
        brandAccess = brandAccess == null ? List.of() : List.copyOf(brandAccess);
    }

    /** The owner membership created alongside a new organization. */
    public static OrganizationMember founder(
            String memberId, String organizationId, String userId, Instant createdAt) {
        return new OrganizationMember(
                memberId, organizationId, userId, OrganizationRole.OWNER,
                null, List.of(), null, null, createdAt);
    }

    /** A membership created by accepting an invitation. */
    public static OrganizationMember invited(
            String memberId,
            String organizationId,
            String userId,
            OrganizationRole role,
            List<String> brandAccess,
            String invitedBy,
            Instant invitedAt,
            Instant joinedAt) {
        return new OrganizationMember(
                memberId, organizationId, userId, role,
                null, brandAccess, invitedBy, invitedAt, joinedAt);
    }

    /** The custom capability override, if one is set. */
    public Optional<List<Capability>> customPermissions() {
        return Optional.ofNullable(permissions);
    }

    public boolean isOwner() {
        return role == OrganizationRole.OWNER;
    }

    public OrganizationMember withRole(OrganizationRole newRole) {
        return new OrganizationMember(
                memberId, organizationId, userId, newRole,
                permissions, brandAccess, invitedBy, invitedAt, joinedAt);
    }

    public OrganizationMember withBrandAccess(List<String> newBrandAccess) {
        return new OrganizationMember(
                memberId, organizationId, userId, role,
                permissions, newBrandAccess, invitedBy, invitedAt, joinedAt);
    }
}
