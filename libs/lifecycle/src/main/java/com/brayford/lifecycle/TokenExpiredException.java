package com.brayford.lifecycle;

import com.brayford.security.BrayfordException;

import java.time.Instant;

/**
 * The confirmation link was used at or after its expiry. The request stays pending; the user
 * has to start a new request.
 */
public class TokenExpiredException extends BrayfordException {

    public static final String CODE = "token-expired";

    private final String requestId;
    private final Instant expiredAt;

    public TokenExpiredException(String requestId, Instant expiredAt) {
        super("Confirmation link has expired. Please request deletion again.");
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
