package com.brayford.lifecycle;

import com.brayford.security.BrayfordException;

import java.time.Instant;

/**
 * The undo link was used after its window closed, or the request never had an undo token.
 */
public class UndoExpiredException extends BrayfordException {

    public static final String CODE = "undo-expired";

    private final String requestId;
    private final Instant expiredAt;

    /**
     * @param expiredAt when the undo window closed; null if there was never an undo token
     */
    public UndoExpiredException(String requestId, Instant expiredAt) {
        super("Undo window has expired. The deletion can no longer be reversed.");
        this.requestId = requestId;
        this.expiredAt = expiredAt;
    }

    public String requestId() {
        return requestId;
    }

    public Instant expiredAt() {
        return expiredAt;
    }

    @Override
    public String errorCode() {
        return CODE;
    }
}
