package com.brayford.security;

import java.time.Instant;

/**
 * Validates an {@link OrganizationMember} against the rules that need more than the record's own
 * constructor can see, chiefly the current time.
 *
 * <p>Collects every violation instead of stopping at the first.
 */
public final class MemberValidator {

    private MemberValidator() {
        // utility class
    }

    /**
     * @param member the membership to validate
     * @param now    the current time, read once by the caller
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(OrganizationMember member, Instant now) {
        var errors = new java.util.ArrayList<String>();

        if (isBlank(member.memberId())) {
            errors.add("memberId must not be null or blank");
        }
        if (isBlank(member.organizationId())) {
            errors.add("organizationId must not be null or blank");
        }
        if (isBlank(member.userId())) {
            errors.add("userId must not be null or blank");
        }
        if (member.joinedAt().isAfter(now)) {
            errors.add("joinedAt must not be in the future");
        }
        if (member.invitedAt() != null && member.invitedAt().isAfter(member.joinedAt())) {
            errors.add("invitedAt must not be after joinedAt");
        }
        if (member.invitedBy() != null && member.invitedBy().equals(member.userId())) {
            errors.add("a member cannot invite themselves");
        }
        for (String brandId : member.brandAccess()) {
            if (isBlank(brandId)) {
                errors.add("brandAccess must not contain blank brand ids");
                break;
            }
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
