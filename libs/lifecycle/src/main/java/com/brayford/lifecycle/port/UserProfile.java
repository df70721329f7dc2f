package com.brayford.lifecycle.port;

/**
 * Contact details for a user.
 *
 * @param displayName may be null
 */
public record UserProfile(String userId, String email, String displayName) {

    /** Display name if set, otherwise the email address. */
    public String bestName() {
        return displayName != null && !displayName.isBlank() ? displayName : email;
    }
}
