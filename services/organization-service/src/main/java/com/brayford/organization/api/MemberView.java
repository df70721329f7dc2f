package com.brayford.organization.api;

import com.brayford.security.Capability;
import com.brayford.security.OrganizationMember;
import com.brayford.security.PermissionChecker;
import java.time.Instant;
import java.util.List;

/**
 * A member as returned over HTTP, with the effective permissions resolved.
 */
public record MemberView(
        String memberId,
        String organizationId,
        String userId,
        String role,
        List<String> permissions,
        List<String> brandAccess,
        String invitedBy,
        Instant invitedAt,
        Instant joinedAt) {

    public static MemberView of(OrganizationMember member) {
        return new MemberView(
                member.memberId(),
                member.organizationId(),
                member.userId(),
                member.role().value(),
                PermissionChecker.effectivePermissions(member).stream().map(Capability::tag).toList(),
                member.brandAccess(),
                member.invitedBy(),
                member.invitedAt(),
                member.joinedAt());
    }
}
