package com.brayford.security;

import java.util.Optional;

/**
 * A member's role within one organization. Exactly one role per (organization, user) pair.
 *
 * <ul>
 *   <li>OWNER: full control including billing and organization deletion</li>
 *   <li>ADMIN: manages the team and every brand and event</li>
 *   <li>MEMBER: works inside the brands it has been granted</li>
 * </ul>
 */
public enum OrganizationRole {

    OWNER("owner", "Owner", "Full control over organization, billing, and all resources"),
    ADMIN("admin", "Admin", "Manage team members and all brands/events"),
    MEMBER("member", "Member", "Access to assigned brands only");

    private final String value;
    private final String displayName;
    private final String description;

    OrganizationRole(String value, String displayName, String description) {
        this.value = value;
        this.displayName = displayName;
        this.description = description;
    }

    /** The canonical string stored on member records (e.g. "owner"). */
    public String value() {
        return value;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    /** Owners and admins see every brand regardless of their brand-access list. */
    public boolean hasImplicitBrandAccess() {
        return this == OWNER || this == ADMIN;
    }

    /**
     * Looks up a role by its canonical value, ignoring case.
     *
     * @param value the string to match (e.g. "admin")
     * @return the matching role, or empty if unknown
     */
    public static Optional<OrganizationRole> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (OrganizationRole role : values()) {
            if (role.value.equalsIgnoreCase(value.strip())) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
