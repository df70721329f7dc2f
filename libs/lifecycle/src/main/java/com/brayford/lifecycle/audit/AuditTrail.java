package com.brayford.lifecycle.audit;

import com.brayford.lifecycle.DeletionRequest;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Append-only, chronological log of the actions taken on a deletion request.
 *
 * <p>Appending never touches the receiver; it returns a new trail one entry longer. A reader
 * holding an older trail keeps a valid snapshot of the history. Serialized as a bare JSON array.
 *
 * @param entries entries in the order they were appended
 */
public record AuditTrail(List<AuditEntry> entries) {

    private static final AuditTrail EMPTY = new AuditTrail(List.of());

    public AuditTrail {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AuditTrail of(List<AuditEntry> entries) {
        return new AuditTrail(entries);
    }

    @Override
    @JsonValue
    public List<AuditEntry> entries() {
        return entries;
    }

    public static AuditTrail empty() {
        return EMPTY;
    }

    /** Returns the request's trail plus one new entry. The request is left as it was. */
    public static AuditTrail appendEntry(
            DeletionRequest request, String action, String actorId, Map<String, Object> metadata, Instant at) {
        return request.auditTrail().append(action, actorId, metadata, at);
    }

    /** Returns a new trail with one additional entry at the end. */
    public AuditTrail append(String action, String actorId, Map<String, Object> metadata, Instant at) {
        var next = new ArrayList<AuditEntry>(entries.size() + 1);
        next.addAll(entries);
        next.add(new AuditEntry(at, action, actorId, metadata));
        return new AuditTrail(next);
    }

    public int size() {
        return entries.size();
    }

    public AuditEntry latest() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("audit trail is empty");
        }
        return entries.get(entries.size() - 1);
    }
}
