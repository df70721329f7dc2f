package com.brayford.lifecycle;

import com.brayford.lifecycle.audit.AuditEntry;

import java.time.Instant;
import java.util.List;

/**
 * Archival record of a deleted organization, written when its deletion completes and kept after
 * everything else about the organization is gone.
 */
public record DeletedOrganizationAudit(
        String organizationId,
        String organizationName,
        String deletionRequestId,
        String requestedBy,
        Instant requestedAt,
        Instant confirmedAt,
        Instant completedAt,
        int memberCount,
        List<AuditEntry> auditTrail) {

    public DeletedOrganizationAudit {
        auditTrail = auditTrail == null ? List.of() : List.copyOf(auditTrail);
    }

    /**
     * @throws IllegalArgumentException if the request is not completed
     */
    public static DeletedOrganizationAudit of(DeletionRequest completed, int memberCount) {
        if (completed.status() != DeletionStatus.COMPLETED) {
            throw new IllegalArgumentException("request " + completed.id() + " is not completed");
        }
        return new DeletedOrganizationAudit(
                completed.organizationId(),
                completed.organizationName(),
                completed.id(),
                completed.requestedBy(),
                completed.requestedAt(),
                completed.confirmedAt(),
                completed.completedAt(),
                memberCount,
                completed.auditTrail().entries());
    }
}
