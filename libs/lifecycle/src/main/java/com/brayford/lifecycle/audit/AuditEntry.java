package com.brayford.lifecycle.audit;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One immutable line of a deletion request's audit trail.
 *
 * @param timestamp when the action happened
 * @param action    free-text description, e.g. "Deletion requested"
 * @param userId    acting user; null for system-triggered actions
 * @param metadata  structured detail; empty when none
 */
public record AuditEntry(Instant timestamp, String action, String userId, Map<String, Object> metadata) {

    public AuditEntry {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action must not be null or blank");
        }
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Whether the action was performed by the system rather than a user. */
    @JsonIgnore
    public boolean isSystemAction() {
        return userId == null;
    }
}
