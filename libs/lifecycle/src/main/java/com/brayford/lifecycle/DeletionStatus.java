package com.brayford.lifecycle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Lifecycle states of an organization deletion request.
 *
 * <pre>
 * PENDING_EMAIL ──confirm──▶ CONFIRMED_DELETION ──undo──────▶ CANCELLED
 *                                     │
 *                                     └──────complete──▶ COMPLETED
 * </pre>
 *
 * CANCELLED and COMPLETED are terminal.
 */
public enum DeletionStatus {

    /** Waiting for the requester to follow the emailed confirmation link. */
    PENDING_EMAIL("pending-email"),

    /** Confirmed; the organization is soft-deleted and the grace period is running. */
    CONFIRMED_DELETION("confirmed-deletion"),

    /** Undone inside the undo window. */
    CANCELLED("cancelled"),

    /** Permanently deleted after the grace period. */
    COMPLETED("completed");

    private final String value;

    DeletionStatus(String value) {
        this.value = value;
    }

    /** Canonical string stored on the request document (e.g. "pending-email"). */
    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == CANCELLED || this == COMPLETED;
    }

    /**
     * @throws IllegalArgumentException if the value is not a known status
     */
    @JsonCreator
    public static DeletionStatus fromValue(String value) {
        return fromString(value)
                .orElseThrow(() -> new IllegalArgumentException("unknown deletion status: " + value));
    }

    public static Optional<DeletionStatus> fromString(String value) {
        for (DeletionStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
