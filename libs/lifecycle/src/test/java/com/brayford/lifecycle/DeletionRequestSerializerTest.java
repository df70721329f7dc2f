package com.brayford.lifecycle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DeletionRequestSerializer")
class DeletionRequestSerializerTest {

    private static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");

    private final DeletionLifecycle lifecycle = new DeletionLifecycle(DeletionPolicy.defaults(), () -> "tok");

    @Test
    @DisplayName("writes statuses by value and instants as ISO-8601")
    void writesReadableJson() {
        var confirmed = lifecycle.confirm(
                lifecycle.request("req-1", "org-1", "Acme", "user-1", Map.of(), NOW), "tok", NOW);

        String json = DeletionRequestSerializer.serialize(confirmed);

        assertThat(json)
                .contains("\"status\":\"confirmed-deletion\"")
                .contains("\"confirmedVia\":\"email-link\"")
                .contains("\"requestedAt\":\"2026-02-01T10:00:00Z\"")
                .contains("\"auditTrail\":[{")
                .doesNotContain("scheduledForDeletion");
    }

    @Test
    @DisplayName("reads back an equal request")
    void readsBack() {
        var confirmed = lifecycle.confirm(
                lifecycle.request("req-1", "org-1", "Acme", "user-1", Map.of("requesterEmail", "a@b.test"), NOW),
                "tok", NOW.plus(Duration.ofHours(1)));

        var restored = DeletionRequestSerializer.deserialize(DeletionRequestSerializer.serialize(confirmed));

        assertThat(restored).isEqualTo(confirmed);
    }

    @Test
    @DisplayName("rejects JSON that breaks request invariants")
    void rejectsInvalidDocument() {
        String json = """
                {"id":"req-1","organizationId":"org-1","organizationName":"Acme","requestedBy":"u",
                 "requestedAt":"2026-02-01T10:00:00Z","confirmationToken":"t",
                 "tokenExpiresAt":"2026-02-02T10:00:00Z","status":"pending-email",
                 "scheduledDeletionAt":"2026-03-01T10:00:00Z","version":0}
                """;

        assertThatThrownBy(() -> DeletionRequestSerializer.deserialize(json))
                .isInstanceOf(DeletionRequestSerializer.DeletionSerializationException.class);
    }

    @Test
    @DisplayName("archives a completed request with its member count")
    void archivesCompletedRequest() {
        var completed = lifecycle.complete(
                lifecycle.confirm(lifecycle.request("req-1", "org-1", "Acme", "user-1", Map.of(), NOW), "tok", NOW),
                NOW.plus(Duration.ofDays(28))).orElseThrow();

        String json = DeletionRequestSerializer.serializeArchive(DeletedOrganizationAudit.of(completed, 4));

        assertThat(json)
                .contains("\"memberCount\":4")
                .contains("\"deletionRequestId\":\"req-1\"")
                .contains("Deletion completed");
    }
}
