package com.brayford.security;

import java.util.Objects;

/**
 * An atomic permission that gates one action inside an organization.
 *
 * <p>A capability is either a {@link Specific} {@code category:action} tag or the {@link All}
 * wildcard that grants every capability. The wildcard is its own variant rather than a reserved
 * tag value, so no catalog entry can ever collide with it.
 */
public sealed interface Capability permits Capability.Specific, Capability.All {

    /** The wildcard capability, held by owners. */
    Capability ALL = new All();

    /** Canonical string form used in storage: {@code category:action}, or {@code *}. */
    String tag();

    /** Whether holding this capability satisfies a check for {@code required}. */
    boolean covers(Capability required);

    /**
     * Creates a specific capability.
     *
     * @throws IllegalArgumentException if either part is blank or contains a colon
     */
    static Specific of(String category, String action) {
        return new Specific(category, action);
    }

    /**
     * Parses a stored tag back into a capability. {@code "*"} yields {@link #ALL}.
     *
     * @throws IllegalArgumentException if the tag is not {@code *} or {@code category:action}
     */
    static Capability parse(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("capability tag must not be null or blank");
        }
        String trimmed = tag.strip();
        if (All.TAG.equals(trimmed)) {
            return ALL;
        }
        int separator = trimmed.indexOf(':');
        if (separator <= 0 || separator != trimmed.lastIndexOf(':')) {
            throw new IllegalArgumentException("malformed capability tag: '%s'".formatted(tag));
        }
        return new Specific(trimmed.substring(0, separator), trimmed.substring(separator + 1));
    }

    /**
     * A single {@code category:action} capability such as {@code brands:delete}.
     *
     * @param category resource family (org, users, brands, events, analytics)
     * @param action   verb within the family
     */
    record Specific(String category, String action) implements Capability {

        public Specific {
            requirePart(category, "category");
            requirePart(action, "action");
        }

        @Override
        public String tag() {
            return category + ":" + action;
        }

        @Override
        public boolean covers(Capability required) {
            return equals(required);
        }

        @Override
        public String toString() {
            return tag();
        }

        private static void requirePart(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
            if (value.indexOf(':') >= 0) {
                throw new IllegalArgumentException(name + " must not contain ':'");
            }
        }
    }

    /** The wildcard. Use {@link Capability#ALL} rather than constructing new instances. */
    final class All implements Capability {

        static final String TAG = "*";

        private All() {
        }

        @Override
        public String tag() {
            return TAG;
        }

        @Override
        public boolean covers(Capability required) {
            return true;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof All;
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(TAG);
        }

        @Override
        public String toString() {
            return TAG;
        }
    }
}
