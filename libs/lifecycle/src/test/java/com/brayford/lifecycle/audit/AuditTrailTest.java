package com.brayford.lifecycle.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuditTrail")
class AuditTrailTest {

    private static final Instant T0 = Instant.parse("2026-02-01T10:00:00Z");

    @Test
    @DisplayName("append returns a longer trail and leaves the original untouched")
    void appendIsNonDestructive() {
        var first = AuditTrail.empty().append("one", "user-1", Map.of(), T0);
        var second = first.append("two", null, Map.of("k", "v"), T0.plusSeconds(5));

        assertThat(first.size()).isEqualTo(1);
        assertThat(second.size()).isEqualTo(2);
        assertThat(second.entries()).extracting(AuditEntry::action).containsExactly("one", "two");
        assertThat(second.latest().isSystemAction()).isTrue();
    }

    @Test
    @DisplayName("entries cannot be modified through the list")
    void entriesAreImmutable() {
        var trail = AuditTrail.empty().append("one", "user-1", null, T0);

        assertThatThrownBy(() -> trail.entries().add(new AuditEntry(T0, "x", null, null)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("metadata is copied on the way in and empty when absent")
    void metadataCopied() {
        var source = new HashMap<String, Object>();
        source.put("key", "before");
        var entry = new AuditEntry(T0, "action", "user-1", source);
        source.put("key", "after");

        assertThat(entry.metadata()).containsEntry("key", "before");
        assertThat(new AuditEntry(T0, "action", null, null).metadata()).isEmpty();
    }

    @Test
    @DisplayName("an entry needs a timestamp and an action")
    void entryValidation() {
        assertThatThrownBy(() -> new AuditEntry(null, "a", null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AuditEntry(T0, " ", null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("latest() on an empty trail fails")
    void latestOnEmpty() {
        assertThatThrownBy(() -> AuditTrail.empty().latest()).isInstanceOf(IllegalStateException.class);
    }
}
