package com.brayford.observability;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps deletion tokens, the links that embed them and recipient addresses out of log output.
 * <p>
 * A field is sensitive when its name contains one of the configured fragments, ignoring case.
 * The defaults catch {@code confirmationToken}, {@code undoLink}, {@code confirmationUrl} and
 * credential-like names.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    public static final Set<String> DEFAULT_FRAGMENTS =
            Set.of("token", "link", "url", "password", "secret", "authorization");

    private final Set<String> fragments;

    public SensitiveDataRedactor() {
        this(DEFAULT_FRAGMENTS);
    }

    /**
     * @param fragments field-name fragments treated as sensitive, matched ignoring case
     */
    public SensitiveDataRedactor(Set<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new IllegalArgumentException("fragments must not be null or empty");
        }
        this.fragments = fragments.stream()
                .map(f -> f.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Copy of {@code data}, in the same order, with every sensitive value replaced by
     * {@value #REDACTED}. Null yields an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        var copy = new LinkedHashMap<String, Object>();
        if (data != null) {
            data.forEach((field, value) -> copy.put(field, isSensitive(field) ? REDACTED : value));
        }
        return copy;
    }

    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        String name = fieldName.toLowerCase(Locale.ROOT);
        return fragments.stream().anyMatch(name::contains);
    }

    /**
     * Shortens an email address to its first character and domain, e.g. {@code o***@acme.test}.
     * Values that are not addresses are fully redacted.
     */
    public static String maskEmail(String email) {
        if (email == null) {
            return null;
        }
        int at = email.indexOf('@');
        if (at < 1) {
            return REDACTED;
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
