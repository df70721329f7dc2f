package com.brayford.security;

/**
 * The caller of a request, as asserted by the upstream identity layer.
 *
 * @param userId      unique user identifier
 * @param email       the user's email address, used as the notification recipient
 * @param displayName human-readable name shown in notification copy
 */
public record AuthenticatedUser(String userId, String email, String displayName) {

    public AuthenticatedUser {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
    }

    /** Display name if present, otherwise the email, otherwise the user id. */
    public String bestName() {
        if (displayName != null && !displayName.isBlank()) {
            return displayName;
        }
        return email != null && !email.isBlank() ? email : userId;
    }
}
