package com.brayford.lifecycle;

import com.brayford.security.BrayfordException;

/**
 * A transition was attempted from a state that does not allow it, e.g. confirming an
 * already-confirmed request or undoing a pending one.
 */
public class InvalidTransitionException extends BrayfordException {

    public static final String CODE = "invalid-transition";

    private final String requestId;
    private final DeletionStatus currentStatus;
    private final String transition;

    public InvalidTransitionException(String requestId, DeletionStatus currentStatus, String transition) {
        super(String.format("Cannot %s deletion request %s: request is %s",
                transition, requestId, currentStatus.value()));
        this.requestId = requestId;
        this.currentStatus = currentStatus;
        this.transition = transition;
    }

    public String requestId() {
        return requestId;
    }

    public DeletionStatus currentStatus() {
        return currentStatus;
    }

    public String transition() {
        return transition;
    }

    @Override
    public String errorCode() {
        return CODE;
    }
}
