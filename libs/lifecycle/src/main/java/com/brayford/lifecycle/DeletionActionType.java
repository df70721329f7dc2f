package com.brayford.lifecycle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a deletion request was acted upon.
 */
public enum DeletionActionType {

    /** The requester followed the emailed confirmation link. */
    EMAIL_LINK("email-link"),

    /** A member followed the undo link. Reserved for the undo path; never a confirmation method. */
    MANUAL_UNDO("manual-undo"),

    /** The scheduled completion job. */
    SYSTEM_CLEANUP("system-cleanup");

    private final String value;

    DeletionActionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * @throws IllegalArgumentException if the value is not a known action type
     */
    @JsonCreator
    public static DeletionActionType fromValue(String value) {
        for (DeletionActionType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown deletion action type: " + value);
    }
}
