package com.brayford.organization.api;

import com.brayford.lifecycle.DeletionRequest;
import com.brayford.lifecycle.audit.AuditEntry;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Deletion request as returned over HTTP. Never includes the confirmation or undo token.
 */
public record DeletionRequestView(
        String id,
        String organizationId,
        String organizationName,
        String status,
        String requestedBy,
        Instant requestedAt,
        Instant tokenExpiresAt,
        Instant confirmedAt,
        String confirmedVia,
        Instant scheduledDeletionAt,
        Instant undoExpiresAt,
        Instant completedAt,
        List<AuditLine> auditTrail) {

    public record AuditLine(Instant timestamp, String action, String userId, Map<String, Object> metadata) {

        static AuditLine of(AuditEntry entry) {
            return new AuditLine(entry.timestamp(), entry.action(), entry.userId(), entry.metadata());
        }
    }

    public static DeletionRequestView of(DeletionRequest request) {
        return new DeletionRequestView(
                request.id(),
                request.organizationId(),
                request.organizationName(),
                request.status().value(),
                request.requestedBy(),
                request.requestedAt(),
                request.tokenExpiresAt(),
                request.confirmedAt(),
                request.confirmedVia() == null ? null : request.confirmedVia().value(),
                request.scheduledDeletionAt(),
                request.undoExpiresAt(),
                request.completedAt(),
                request.auditTrail().entries().stream().map(AuditLine::of).toList());
    }
}
