package com.brayford.security;

/**
 * Who may change whose role, who may invite at which role, and when an owner may step down.
 *
 * <p>The hierarchy is strict and asymmetric:
 * <ul>
 *   <li>members modify and invite no one</li>
 *   <li>admins modify only members, and invite admins or members</li>
 *   <li>owners modify anyone except other owners, and invite any role</li>
 * </ul>
 * An owner's role changes only through {@link #canChangeSelfRole}, which requires another owner
 * to remain.
 */
public final class RoleHierarchyPolicy {

    /** Minimum owner count (including the actor) for an owner to change their own role. */
    public static final int MIN_OWNERS_FOR_SELF_CHANGE = 2;

    private RoleHierarchyPolicy() {
        // utility class
    }

    public static boolean canModifyMemberRole(OrganizationMember actor, OrganizationMember target) {
        return switch (actor.role()) {
            case MEMBER -> false;
            case ADMIN -> target.role() == OrganizationRole.MEMBER;
            case OWNER -> target.role() != OrganizationRole.OWNER;
        };
    }

    public static boolean canInviteRole(OrganizationMember actor, OrganizationRole targetRole) {
        return switch (actor.role()) {
            case MEMBER -> false;
            case ADMIN -> targetRole != OrganizationRole.OWNER;
            case OWNER -> true;
        };
    }

    /**
     * Whether the actor may change their own role. Only owners may, and only while at least one
     * other owner exists.
     *
     * @param currentOwnerCount owners in the organization, including the actor
     */
    public static boolean canChangeSelfRole(OrganizationMember actor, int currentOwnerCount) {
        if (actor.role() != OrganizationRole.OWNER) {
            return false;
        }
        return currentOwnerCount >= MIN_OWNERS_FOR_SELF_CHANGE;
    }

    /** @throws PermissionDeniedException if the actor may not modify the target's role */
    public static void requireCanModifyMemberRole(OrganizationMember actor, OrganizationMember target) {
        if (!canModifyMemberRole(actor, target)) {
            throw PermissionDeniedException.forAction(
                    actor.role(), "modify %s role".formatted(target.role().value()));
        }
    }

    /** @throws PermissionDeniedException if the actor may not invite at this role */
    public static void requireCanInviteRole(OrganizationMember actor, OrganizationRole targetRole) {
        if (!canInviteRole(actor, targetRole)) {
            throw PermissionDeniedException.forAction(
                    actor.role(), "invite %s role".formatted(targetRole.value()));
        }
    }

    /**
     * @throws PermissionDeniedException  if the actor is not an owner
     * @throws LastOwnerLockoutException  if the actor is the organization's only owner
     */
    public static void requireCanChangeSelfRole(OrganizationMember actor, int currentOwnerCount) {
        if (actor.role() != OrganizationRole.OWNER) {
            throw PermissionDeniedException.forAction(actor.role(), "change own role");
        }
        if (!canChangeSelfRole(actor, currentOwnerCount)) {
            throw new LastOwnerLockoutException(actor.organizationId(), actor.userId(), currentOwnerCount);
        }
    }
}
