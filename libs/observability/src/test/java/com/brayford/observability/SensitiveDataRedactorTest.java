package com.brayford.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Test
    @DisplayName("redacts deletion tokens and links, keeps the rest in order")
    void redactsDeletionFields() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("organizationName", "Acme Live");
        data.put("confirmationLink", "https://app/confirm?token=abc");
        data.put("undoToken", "u-123");
        data.put("confirmationUrl", "https://app/x");
        data.put("expiresAt", "2 February 2026, 10:00");

        Map<String, Object> result = redactor.redact(data);

        assertThat(result).containsExactly(
                Map.entry("organizationName", "Acme Live"),
                Map.entry("confirmationLink", SensitiveDataRedactor.REDACTED),
                Map.entry("undoToken", SensitiveDataRedactor.REDACTED),
                Map.entry("confirmationUrl", SensitiveDataRedactor.REDACTED),
                Map.entry("expiresAt", "2 February 2026, 10:00"));
    }

    @Test
    @DisplayName("matches case-insensitively and tolerates null input")
    void caseInsensitive() {
        assertThat(redactor.isSensitive("UNDO_TOKEN")).isTrue();
        assertThat(redactor.isSensitive("Authorization")).isTrue();
        assertThat(redactor.isSensitive("recipient")).isFalse();
        assertThat(redactor.isSensitive(null)).isFalse();
        assertThat(redactor.redact(null)).isEmpty();
    }

    @Test
    @DisplayName("custom patterns replace the defaults")
    void customPatterns() {
        var custom = new SensitiveDataRedactor(Set.of("recipient"));
        assertThat(custom.isSensitive("recipient")).isTrue();
        assertThat(custom.isSensitive("undoToken")).isFalse();
        assertThatThrownBy(() -> new SensitiveDataRedactor(Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("maskEmail() keeps the first character and the domain")
    void maskEmail() {
        assertThat(SensitiveDataRedactor.maskEmail("olive@acme.test")).isEqualTo("o***@acme.test");
        assertThat(SensitiveDataRedactor.maskEmail("not-an-address")).isEqualTo(SensitiveDataRedactor.REDACTED);
        assertThat(SensitiveDataRedactor.maskEmail("@acme.test")).isEqualTo(SensitiveDataRedactor.REDACTED);
        assertThat(SensitiveDataRedactor.maskEmail(null)).isNull();
    }
}
