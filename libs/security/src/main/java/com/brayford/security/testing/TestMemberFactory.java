package com.brayford.security.testing;

import com.brayford.security.Capability;
import com.brayford.security.OrganizationMember;
import com.brayford.security.OrganizationRole;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Factory for {@link OrganizationMember} instances in tests.
 *
 * <p>Lives in {@code src/main} so other modules can use it from their test scope through a plain
 * Maven dependency.
 */
public final class TestMemberFactory {

    public static final String DEFAULT_ORGANIZATION_ID = "org-test-001";
    public static final Instant DEFAULT_JOINED_AT = Instant.parse("2026-01-01T09:00:00Z");

    private TestMemberFactory() {
        // utility class
    }

    public static OrganizationMember owner() {
        return withRole(OrganizationRole.OWNER);
    }

    public static OrganizationMember admin() {
        return withRole(OrganizationRole.ADMIN);
    }

    /** A MEMBER-role user with access to the given brands (none if omitted). */
    public static OrganizationMember member(String... brandIds) {
        return create(randomUserId(), DEFAULT_ORGANIZATION_ID, OrganizationRole.MEMBER, List.of(brandIds));
    }

    public static OrganizationMember withRole(OrganizationRole role) {
        return create(randomUserId(), DEFAULT_ORGANIZATION_ID, role, List.of());
    }

    /** A member whose capabilities come from an explicit override instead of the role. */
    public static OrganizationMember withCustomPermissions(OrganizationRole role, Capability... capabilities) {
        return new OrganizationMember(
                "mem-" + UUID.randomUUID(), DEFAULT_ORGANIZATION_ID, randomUserId(), role,
                List.of(capabilities), List.of(), null, null, DEFAULT_JOINED_AT);
    }

    public static OrganizationMember create(
            String userId, String organizationId, OrganizationRole role, List<String> brandAccess) {
        return new OrganizationMember(
                "mem-" + userId, organizationId, userId, role,
                null, brandAccess, null, null, DEFAULT_JOINED_AT);
    }

    private static String randomUserId() {
        return "user-" + UUID.randomUUID();
    }
}
