package com.brayford.lifecycle;

import com.brayford.lifecycle.audit.AuditTrail;
import com.brayford.security.ValidationResult;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;

/**
 * One request to delete an organization, from the first click through to permanent removal.
 *
 * <p>Instances are immutable. Every transition in {@link DeletionLifecycle} returns a new request
 * with {@link #version} one higher, so a store can detect a lost update.
 *
 * <p>The constructor enforces the per-state shape:
 * <ul>
 *   <li>{@code scheduledDeletionAt} is set exactly when the status is CONFIRMED_DELETION</li>
 *   <li>undo token and undo expiry are set together, and only while CONFIRMED_DELETION</li>
 *   <li>{@code confirmedAt} and {@code confirmedVia} are set together, never while PENDING_EMAIL,
 *       always once CONFIRMED_DELETION or COMPLETED</li>
 *   <li>{@code completedAt} is set exactly when the status is COMPLETED</li>
 * </ul>
 *
 * @param id                      request id
 * @param organizationId          the organization being deleted
 * @param organizationName        name the requester typed to confirm intent
 * @param requestedBy             user id of the requester
 * @param requestedAt             when the request was made
 * @param confirmationToken       secret carried by the emailed confirmation link
 * @param tokenExpiresAt          when the confirmation token stops being accepted
 * @param confirmationEmailSentAt when the confirmation email was dispatched
 * @param status                  current lifecycle state
 * @param confirmedAt             when the request was confirmed
 * @param confirmedVia            how it was confirmed
 * @param scheduledDeletionAt     when permanent deletion becomes due
 * @param undoToken               secret carried by the undo link
 * @param undoExpiresAt           when the undo token stops being accepted
 * @param completedAt             when permanent deletion ran
 * @param auditTrail              chronological history of actions
 * @param version                 optimistic-concurrency counter
 */
public record DeletionRequest(
        String id,
        String organizationId,
        String organizationName,
        String requestedBy,
        Instant requestedAt,
        String confirmationToken,
        Instant tokenExpiresAt,
        Instant confirmationEmailSentAt,
        DeletionStatus status,
        Instant confirmedAt,
        DeletionActionType confirmedVia,
        Instant scheduledDeletionAt,
        String undoToken,
        Instant undoExpiresAt,
        Instant completedAt,
        AuditTrail auditTrail,
        long version) {

    public DeletionRequest {
        auditTrail = auditTrail == null ? AuditTrail.empty() : auditTrail;

        var errors = new ArrayList<String>();
        requireText(errors, id, "id");
        requireText(errors, organizationId, "organizationId");
        requireText(errors, organizationName, "organizationName");
        requireText(errors, requestedBy, "requestedBy");
        requireText(errors, confirmationToken, "confirmationToken");
        if (requestedAt == null) {
            errors.add("requestedAt must not be null");
        }
        if (tokenExpiresAt == null) {
            errors.add("tokenExpiresAt must not be null");
        }
        if (status == null) {
            errors.add("status must not be null");
        }
        if (version < 0) {
            errors.add("version must not be negative");
        }
        if (status != null) {
            checkStateShape(errors, status, confirmedAt, confirmedVia, scheduledDeletionAt,
                    undoToken, undoExpiresAt, completedAt);
        }
        if (!errors.isEmpty()) {
            ValidationResult.fail(errors).orThrow();
        }
    }

    private static void checkStateShape(
            ArrayList<String> errors,
            DeletionStatus status,
            Instant confirmedAt,
            DeletionActionType confirmedVia,
            Instant scheduledDeletionAt,
            String undoToken,
            Instant undoExpiresAt,
            Instant completedAt) {
        boolean confirmed = status == DeletionStatus.CONFIRMED_DELETION;

        if ((scheduledDeletionAt != null) != confirmed) {
            errors.add("scheduledDeletionAt must be set exactly when status is " + DeletionStatus.CONFIRMED_DELETION.value());
        }
        if ((undoToken == null) != (undoExpiresAt == null)) {
            errors.add("undoToken and undoExpiresAt must both be set or both be null");
        }
        if (undoToken != null && !confirmed) {
            errors.add("undo fields are only allowed while " + DeletionStatus.CONFIRMED_DELETION.value());
        }
        if ((confirmedAt == null) != (confirmedVia == null)) {
            errors.add("confirmedAt and confirmedVia must both be set or both be null");
        }
        if (status == DeletionStatus.PENDING_EMAIL && confirmedAt != null) {
            errors.add("a " + status.value() + " request cannot carry confirmedAt");
        }
        if ((confirmed || status == DeletionStatus.COMPLETED) && confirmedAt == null) {
            errors.add("a " + status.value() + " request must carry confirmedAt");
        }
        if ((completedAt != null) != (status == DeletionStatus.COMPLETED)) {
            errors.add("completedAt must be set exactly when status is " + DeletionStatus.COMPLETED.value());
        }
    }

    private static void requireText(ArrayList<String> errors, String value, String field) {
        if (value == null || value.isBlank()) {
            errors.add(field + " must not be null or blank");
        }
    }

    /** Whether the confirmation token is past its expiry. The expiry instant itself is still valid. */
    public boolean isConfirmationTokenExpired(Instant now) {
        return now.isAfter(tokenExpiresAt);
    }

    /** Whether the undo window is closed at {@code now}. A missing undo token counts as closed. */
    public boolean isUndoExpired(Instant now) {
        return undoExpiresAt == null || now.isAfter(undoExpiresAt);
    }

    @JsonIgnore
    public boolean isScheduledForDeletion() {
        return status == DeletionStatus.CONFIRMED_DELETION;
    }

    /** Whether the grace period has run out, making the request eligible for completion. */
    public boolean isDueForCompletion(Instant now) {
        return isScheduledForDeletion() && !now.isBefore(scheduledDeletionAt);
    }

    /**
     * Whether this request stops a new one being opened for the same organization. A pending
     * request whose confirmation token has lapsed and a cancelled request do not.
     */
    public boolean blocksNewRequest(Instant now) {
        return switch (status) {
            case PENDING_EMAIL -> !isConfirmationTokenExpired(now);
            case CONFIRMED_DELETION, COMPLETED -> true;
            case CANCELLED -> false;
        };
    }
}
