package com.brayford.security;

/**
 * Brand-scoped access checks.
 *
 * <p>Owners and admins reach every brand. A MEMBER-role user reaches only the brands listed on its
 * membership, so an empty list means no brand at all.
 */
public final class BrandAccessChecker {

    private BrandAccessChecker() {
        // utility class
    }

    public static boolean hasBrandAccess(OrganizationMember member, String brandId) {
        if (member.role().hasImplicitBrandAccess()) {
            return true;
        }
        return brandId != null && member.brandAccess().contains(brandId);
    }

    /** @throws AccessDeniedException if the member may not access the brand */
    public static void requireBrandAccess(OrganizationMember member, String brandId) {
        if (!hasBrandAccess(member, brandId)) {
            throw new AccessDeniedException(member.role(), brandId);
        }
    }
}
