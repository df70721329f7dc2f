package com.brayford.security;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A capability or role-hierarchy check failed.
 *
 * <p>Carries the actor's role and either the capabilities that were missing or, for hierarchy
 * checks, the action that was attempted.
 */
public class PermissionDeniedException extends BrayfordException {

    public static final String CODE = "permission-denied";

    private final OrganizationRole role;
    private final List<Capability> missing;
    private final String attemptedAction;

    private PermissionDeniedException(
            String message, OrganizationRole role, List<Capability> missing, String attemptedAction) {
        super(message);
        this.role = role;
        this.missing = List.copyOf(missing);
        this.attemptedAction = attemptedAction;
    }

    /** The actor lacks one specific capability. */
    public static PermissionDeniedException missing(OrganizationRole role, Capability capability) {
        return new PermissionDeniedException(
                "Permission denied: %s role lacks required permission \"%s\""
                        .formatted(role.value(), capability.tag()),
                role, List.of(capability), null);
    }

    /** The actor holds none of the acceptable capabilities. */
    public static PermissionDeniedException missingAny(OrganizationRole role, List<Capability> needed) {
        return new PermissionDeniedException(
                "Permission denied: %s role lacks required permissions (needs one of: %s)"
                        .formatted(role.value(), tags(needed)),
                role, needed, null);
    }

    /** The actor lacks some of the required capabilities; {@code missing} lists only those. */
    public static PermissionDeniedException missingAll(OrganizationRole role, List<Capability> missing) {
        return new PermissionDeniedException(
                "Permission denied: %s role lacks required permissions: %s"
                        .formatted(role.value(), tags(missing)),
                role, missing, null);
    }

    /** A role-hierarchy rule refused the action. */
    public static PermissionDeniedException forAction(OrganizationRole role, String attemptedAction) {
        return new PermissionDeniedException(
                "Permission denied: %s cannot %s".formatted(role.value(), attemptedAction),
                role, List.of(), attemptedAction);
    }

    /** The caller has no membership in the organization at all; {@link #role()} is null. */
    public static PermissionDeniedException notAMember(String userId, String organizationId) {
        return new PermissionDeniedException(
                "Permission denied: user %s is not a member of organization %s".formatted(userId, organizationId),
                null, List.of(), "access organization " + organizationId);
    }

    /** The actor's role; null when the caller is not a member. */
    public OrganizationRole role() {
        return role;
    }

    /** Missing capabilities; empty for hierarchy failures. */
    public List<Capability> missing() {
        return missing;
    }

    /** The refused action for hierarchy failures, otherwise null. */
    public String attemptedAction() {
        return attemptedAction;
    }

    @Override
    public String errorCode() {
        return CODE;
    }

    private static String tags(List<Capability> capabilities) {
        return capabilities.stream().map(Capability::tag).collect(Collectors.joining(", "));
    }
}
