package com.brayford.lifecycle;

import com.brayford.security.BrayfordException;

/**
 * The presented link token does not match the one stored on the request.
 */
public class InvalidTokenException extends BrayfordException {

    public static final String CODE = "invalid-token";

    private final String requestId;

    public InvalidTokenException(String requestId, String tokenKind) {
        super("Invalid " + tokenKind + " token");
        this.requestId = requestId;
    }

    public String requestId() {
        return requestId;
    }

    @Override
    public String errorCode() {
        return CODE;
    }
}
