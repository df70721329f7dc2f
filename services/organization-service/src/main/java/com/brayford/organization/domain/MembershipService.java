package com.brayford.organization.domain;

import com.brayford.lifecycle.ResourceNotFoundException;
import com.brayford.lifecycle.WriteConflictException;
import com.brayford.lifecycle.port.MemberStore;
import com.brayford.lifecycle.port.TenantDirectory;
import com.brayford.security.AuthenticatedUser;
import com.brayford.security.LastOwnerLockoutException;
import com.brayford.security.MemberValidator;
import com.brayford.security.OrganizationMember;
import com.brayford.security.OrganizationRole;
import com.brayford.security.PermissionChecker;
import com.brayford.security.PermissionDeniedException;
import com.brayford.security.Permissions;
import com.brayford.security.RoleHierarchyPolicy;
import com.brayford.security.TenantIsolationEnforcer;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Member administration inside one organization, gated by the authorization guard.
 *
 * <p>Writes are conditional on the record read: when the stored member changed in the meantime,
 * or the store refused to leave the organization without an owner, the member is re-read and the
 * whole check re-run, so the caller sees the reason rather than a bare conflict.
 */
public class MembershipService {

    private static final Logger log = LoggerFactory.getLogger(MembershipService.class);

    private final MemberStore members;
    private final TenantDirectory directory;
    private final Clock clock;
    private final int maxWriteAttempts;

    public MembershipService(MemberStore members, TenantDirectory directory, Clock clock, int maxWriteAttempts) {
        this.members = members;
        this.directory = directory;
        this.clock = clock;
        this.maxWriteAttempts = maxWriteAttempts;
    }

    /** Every member of the organization; needs {@code users:view}. */
    public List<OrganizationMember> listMembers(String organizationId, AuthenticatedUser caller) {
        OrganizationMember actor = requireMember(organizationId, caller);
        PermissionChecker.requireCapability(actor, Permissions.USERS_VIEW);
        return members.listByOrganization(organizationId);
    }

    /**
     * Adds a user who accepted an invitation from the caller.
     *
     * @throws IllegalArgumentException if the user is already a member or the record is invalid
     */
    public OrganizationMember addInvitedMember(
            String organizationId,
            AuthenticatedUser caller,
            String userId,
            OrganizationRole role,
            List<String> brandAccess) {
        Instant now = clock.instant();
        directory.findOrganization(organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("organization", organizationId));
        OrganizationMember actor = requireMember(organizationId, caller);
        PermissionChecker.requireCapability(actor, Permissions.USERS_INVITE);
        RoleHierarchyPolicy.requireCanInviteRole(actor, role);

        if (members.findByOrganizationAndUser(organizationId, userId).isPresent()) {
            throw new IllegalArgumentException("User " + userId + " is already a member of this organization");
        }
        OrganizationMember member = OrganizationMember.invited(
                "mem-" + UUID.randomUUID(), organizationId, userId, role, brandAccess,
                actor.userId(), now, now);
        MemberValidator.validate(member, now).orThrow();
        try {
            members.create(member);
        } catch (IllegalStateException e) {
            throw new IllegalArgumentException("User " + userId + " is already a member of this organization", e);
        }

        log.info("User {} added to organization {} as {} by {}",
                userId, organizationId, role.value(), actor.userId());
        return member;
    }

    /**
     * Changes a member's role. Changing one's own role is only open to owners while another owner
     * remains; otherwise the caller needs {@code users:update_role}, must outrank the target and
     * may only hand out roles they could invite.
     */
    public OrganizationMember changeRole(
            String organizationId, String memberId, AuthenticatedUser caller, OrganizationRole newRole) {
        OrganizationMember updated = writeWithRetry(memberId, "change role", target -> {
            OrganizationMember actor = requireMember(organizationId, caller);
            TenantIsolationEnforcer.enforce(target, organizationId);
            if (target.role() == newRole) {
                return Optional.empty();
            }
            if (target.memberId().equals(actor.memberId())) {
                RoleHierarchyPolicy.requireCanChangeSelfRole(actor, (int) members.countOwners(organizationId));
            } else {
                PermissionChecker.requireCapability(actor, Permissions.USERS_UPDATE_ROLE);
                RoleHierarchyPolicy.requireCanModifyMemberRole(actor, target);
                RoleHierarchyPolicy.requireCanInviteRole(actor, newRole);
            }
            return Optional.of(target.withRole(newRole));
        });
        log.info("Member {} of organization {} is now {}", memberId, organizationId, updated.role().value());
        return updated;
    }

    /** Replaces a member's brand-access list; needs {@code users:update_access}. */
    public OrganizationMember updateBrandAccess(
            String organizationId, String memberId, AuthenticatedUser caller, List<String> brandAccess) {
        OrganizationMember updated = writeWithRetry(memberId, "update brand access", target -> {
            OrganizationMember actor = requireMember(organizationId, caller);
            TenantIsolationEnforcer.enforce(target, organizationId);
            PermissionChecker.requireCapability(actor, Permissions.USERS_UPDATE_ACCESS);
            OrganizationMember next = target.withBrandAccess(brandAccess);
            MemberValidator.validate(next, clock.instant()).orThrow();
            return Optional.of(next);
        });
        log.info("Brand access of member {} in organization {} set to {}", memberId, organizationId, brandAccess);
        return updated;
    }

    /**
     * Removes a member. Anyone may leave, except the only owner. Removing someone else needs
     * {@code users:remove} and a higher role than theirs.
     */
    public void removeMember(String organizationId, String memberId, AuthenticatedUser caller) {
        for (int attempt = 1; attempt <= maxWriteAttempts; attempt++) {
            OrganizationMember target = members.findById(memberId)
                    .orElseThrow(() -> new ResourceNotFoundException("member", memberId));
            OrganizationMember actor = requireMember(organizationId, caller);
            TenantIsolationEnforcer.enforce(target, organizationId);

            if (target.memberId().equals(actor.memberId())) {
                long owners = members.countOwners(organizationId);
                if (actor.isOwner() && owners < RoleHierarchyPolicy.MIN_OWNERS_FOR_SELF_CHANGE) {
                    throw new LastOwnerLockoutException(organizationId, actor.userId(), (int) owners);
                }
            } else {
                PermissionChecker.requireCapability(actor, Permissions.USERS_REMOVE);
                RoleHierarchyPolicy.requireCanModifyMemberRole(actor, target);
            }

            if (members.delete(target)) {
                log.info("Member {} removed from organization {} by {}", memberId, organizationId, actor.userId());
                return;
            }
            log.info("Concurrent update of member {} during removal; re-reading (attempt {}/{})",
                    memberId, attempt, maxWriteAttempts);
        }
        throw new WriteConflictException(memberId, maxWriteAttempts);
    }

    private OrganizationMember writeWithRetry(
            String memberId, String operation, Function<OrganizationMember, Optional<OrganizationMember>> step) {
        for (int attempt = 1; attempt <= maxWriteAttempts; attempt++) {
            OrganizationMember current = members.findById(memberId)
                    .orElseThrow(() -> new ResourceNotFoundException("member", memberId));
            Optional<OrganizationMember> next = step.apply(current);
            if (next.isEmpty()) {
                return current;
            }
            if (members.replace(current, next.get())) {
                return next.get();
            }
            log.info("Concurrent update of member {} during {}; re-reading (attempt {}/{})",
                    memberId, operation, attempt, maxWriteAttempts);
        }
        throw new WriteConflictException(memberId, maxWriteAttempts);
    }

    private OrganizationMember requireMember(String organizationId, AuthenticatedUser caller) {
        return members.findByOrganizationAndUser(organizationId, caller.userId())
                .orElseThrow(() -> PermissionDeniedException.notAMember(caller.userId(), organizationId));
    }
}
