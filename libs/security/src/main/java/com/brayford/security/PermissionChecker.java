package com.brayford.security;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Capability checks for organization members.
 *
 * <p>{@code has*} methods answer a question; {@code require*} methods perform the same check and
 * throw {@link PermissionDeniedException} for call sites that must abort.
 */
public final class PermissionChecker {

    private PermissionChecker() {
        // utility class
    }

    /**
     * The member's effective capabilities: the custom override verbatim when present, otherwise the
     * default set of the member's role.
     */
    public static Set<Capability> effectivePermissions(OrganizationMember member) {
        return member.customPermissions()
                .<Set<Capability>>map(custom -> Collections.unmodifiableSet(new LinkedHashSet<>(custom)))
                .orElseGet(() -> RolePermissions.forRole(member.role()));
    }

    /**
     * True if the effective set contains the wildcard or contains {@code capability} exactly.
     */
    public static boolean hasCapability(OrganizationMember member, Capability capability) {
        for (Capability granted : effectivePermissions(member)) {
            if (granted.covers(capability)) {
                return true;
            }
        }
        return false;
    }

    /** True if the member holds at least one of the capabilities. */
    public static boolean hasAnyCapability(OrganizationMember member, List<? extends Capability> capabilities) {
        for (Capability capability : capabilities) {
            if (hasCapability(member, capability)) {
                return true;
            }
        }
        return false;
    }

    /** True if the member holds every one of the capabilities. */
    public static boolean hasAllCapabilities(OrganizationMember member, List<? extends Capability> capabilities) {
        return missingCapabilities(member, capabilities).isEmpty();
    }

    /** @throws PermissionDeniedException if the member lacks the capability */
    public static void requireCapability(OrganizationMember member, Capability capability) {
        if (!hasCapability(member, capability)) {
            throw PermissionDeniedException.missing(member.role(), capability);
        }
    }

    /** @throws PermissionDeniedException if the member holds none of the capabilities */
    public static void requireAnyCapability(OrganizationMember member, List<? extends Capability> capabilities) {
        if (!hasAnyCapability(member, capabilities)) {
            throw PermissionDeniedException.missingAny(member.role(), List.copyOf(capabilities));
        }
    }

    /** @throws PermissionDeniedException listing only the capabilities the member lacks */
    public static void requireAllCapabilities(OrganizationMember member, List<? extends Capability> capabilities) {
        List<Capability> missing = missingCapabilities(member, capabilities);
        if (!missing.isEmpty()) {
            throw PermissionDeniedException.missingAll(member.role(), missing);
        }
    }

    private static List<Capability> missingCapabilities(
            OrganizationMember member, List<? extends Capability> capabilities) {
        var missing = new ArrayList<Capability>();
        for (Capability capability : capabilities) {
            if (!hasCapability(member, capability)) {
                missing.add(capability);
            }
        }
        return missing;
    }
}
