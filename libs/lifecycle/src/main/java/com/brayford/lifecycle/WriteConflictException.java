package com.brayford.lifecycle;

import com.brayford.security.BrayfordException;

/**
 * Concurrent writers kept winning the compare-and-swap and the write attempts ran out.
 * Safe to retry.
 */
public class WriteConflictException extends BrayfordException {

    public static final String CODE = "write-conflict";

    private final String resourceId;
    private final int attempts;

    public WriteConflictException(String resourceId, int attempts) {
        super(String.format("Gave up writing %s after %d conflicting attempts", resourceId, attempts));
        this.resourceId = resourceId;
        this.attempts = attempts;
    }

    public String resourceId() {
        return resourceId;
    }

    public int attempts() {
        return attempts;
    }

    @Override
    public String errorCode() {
        return CODE;
    }
}
