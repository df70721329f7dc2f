package com.brayford.lifecycle;

import com.brayford.lifecycle.audit.AuditTrail;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The organization deletion state machine.
 *
 * <p>Every transition is a pure function of the current request and a single {@code now} read
 * by the caller: nothing here reads a clock, touches storage or sends mail. Each successful
 * transition bumps {@link DeletionRequest#version()} and appends exactly one audit entry.
 *
 * <p>Confirm checks the token before anything else, since the link is the only credential and a
 * wrong token must not reveal the request's state. Undo is only reachable by an authorized member,
 * so it checks the state first, then the token, then the window. Expiry instants are inclusive:
 * a token is still accepted at exactly its expiry.
 */
public final class DeletionLifecycle {

    static final String ACTION_REQUESTED = "Deletion requested";
    static final String ACTION_CONFIRMED = "Deletion confirmed via email link";
    static final String ACTION_UNDONE = "Deletion undone";
    static final String ACTION_COMPLETED = "Deletion completed";

    private final DeletionPolicy policy;
    private final TokenGenerator tokens;

    public DeletionLifecycle(DeletionPolicy policy, TokenGenerator tokens) {
        this.policy = policy;
        this.tokens = tokens;
    }

    public DeletionPolicy policy() {
        return policy;
    }

    /**
     * Opens a new request in PENDING_EMAIL with a fresh confirmation token.
     *
     * @param metadata extra audit detail for the creation entry, may be empty
     */
    public DeletionRequest request(
            String requestId,
            String organizationId,
            String organizationName,
            String requestedBy,
            Map<String, Object> metadata,
            Instant now) {
        var details = new LinkedHashMap<String, Object>();
        details.put("organizationName", organizationName);
        if (metadata != null) {
            details.putAll(metadata);
        }
        AuditTrail trail = AuditTrail.empty().append(ACTION_REQUESTED, requestedBy, details, now);

        return new DeletionRequest(
                requestId,
                organizationId,
                organizationName,
                requestedBy,
                now,
                tokens.newToken(),
                now.plus(policy.tokenTtl()),
                now,
                DeletionStatus.PENDING_EMAIL,
                null, null, null, null, null, null,
                trail,
                0L);
    }

    /**
     * PENDING_EMAIL to CONFIRMED_DELETION. Schedules permanent deletion one grace period out and
     * issues an undo token valid for the undo window.
     *
     * @throws InvalidTokenException      if the token does not match
     * @throws InvalidTransitionException if the request is not pending
     * @throws TokenExpiredException      if {@code now} is past the token expiry
     */
    public DeletionRequest confirm(DeletionRequest request, String token, Instant now) {
        if (!tokensMatch(request.confirmationToken(), token)) {
            throw new InvalidTokenException(request.id(), "confirmation");
        }
        if (request.status() != DeletionStatus.PENDING_EMAIL) {
            throw new InvalidTransitionException(request.id(), request.status(), "confirm");
        }
        if (request.isConfirmationTokenExpired(now)) {
            throw new TokenExpiredException(request.id(), request.tokenExpiresAt());
        }

        Instant scheduledDeletionAt = now.plus(policy.gracePeriod());
        Instant undoExpiresAt = now.plus(policy.undoWindow());
        var details = new LinkedHashMap<String, Object>();
        details.put("scheduledDeletionAt", scheduledDeletionAt.toString());
        details.put("undoExpiresAt", undoExpiresAt.toString());
        AuditTrail trail = AuditTrail.appendEntry(request, ACTION_CONFIRMED, request.requestedBy(), details, now);

        return new DeletionRequest(
                request.id(),
                request.organizationId(),
                request.organizationName(),
                request.requestedBy(),
                request.requestedAt(),
                request.confirmationToken(),
                request.tokenExpiresAt(),
                request.confirmationEmailSentAt(),
                DeletionStatus.CONFIRMED_DELETION,
                now,
                DeletionActionType.EMAIL_LINK,
                scheduledDeletionAt,
                tokens.newToken(),
                undoExpiresAt,
                null,
                trail,
                request.version() + 1);
    }

    /**
     * CONFIRMED_DELETION to CANCELLED. Clears the schedule and the undo token.
     *
     * @param actorId the member undoing the deletion
     * @throws InvalidTransitionException if the request is not confirmed
     * @throws UndoExpiredException       if there is no undo token or the window has closed
     * @throws InvalidTokenException      if the token does not match
     */
    public DeletionRequest undo(DeletionRequest request, String token, String actorId, Instant now) {
        if (request.status() != DeletionStatus.CONFIRMED_DELETION) {
            throw new InvalidTransitionException(request.id(), request.status(), "undo");
        }
        if (request.undoToken() == null) {
            throw new UndoExpiredException(request.id(), null);
        }
        if (!tokensMatch(request.undoToken(), token)) {
            throw new InvalidTokenException(request.id(), "undo");
        }
        if (request.isUndoExpired(now)) {
            throw new UndoExpiredException(request.id(), request.undoExpiresAt());
        }

        var details = new LinkedHashMap<String, Object>();
        details.put("undoneByUserId", actorId);
        details.put("undoneVia", DeletionActionType.MANUAL_UNDO.value());
        details.put("cancelledScheduledDeletionAt", request.scheduledDeletionAt().toString());
        AuditTrail trail = AuditTrail.appendEntry(request, ACTION_UNDONE, actorId, details, now);

        return new DeletionRequest(
                request.id(),
                request.organizationId(),
                request.organizationName(),
                request.requestedBy(),
                request.requestedAt(),
                request.confirmationToken(),
                request.tokenExpiresAt(),
                request.confirmationEmailSentAt(),
                DeletionStatus.CANCELLED,
                request.confirmedAt(),
                request.confirmedVia(),
                null, null, null, null,
                trail,
                request.version() + 1);
    }

    /**
     * CONFIRMED_DELETION to COMPLETED once the grace period is over. Returns empty, and changes
     * nothing, when the request is in any other state or still inside its grace period; a
     * completion trigger that fires early or twice is harmless.
     */
    public Optional<DeletionRequest> complete(DeletionRequest request, Instant now) {
        if (!request.isDueForCompletion(now)) {
            return Optional.empty();
        }

        var details = new LinkedHashMap<String, Object>();
        details.put("scheduledDeletionAt", request.scheduledDeletionAt().toString());
        details.put("trigger", DeletionActionType.SYSTEM_CLEANUP.value());
        AuditTrail trail = AuditTrail.appendEntry(request, ACTION_COMPLETED, null, details, now);

        return Optional.of(new DeletionRequest(
                request.id(),
                request.organizationId(),
                request.organizationName(),
                request.requestedBy(),
                request.requestedAt(),
                request.confirmationToken(),
                request.tokenExpiresAt(),
                request.confirmationEmailSentAt(),
                DeletionStatus.COMPLETED,
                request.confirmedAt(),
                request.confirmedVia(),
                null, null, null,
                now,
                trail,
                request.version() + 1));
    }

    // Constant-time so the comparison does not leak how many leading characters matched.
    private static boolean tokensMatch(String expected, String presented) {
        if (presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
