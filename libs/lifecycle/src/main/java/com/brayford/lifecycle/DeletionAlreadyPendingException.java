package com.brayford.lifecycle;

import com.brayford.security.BrayfordException;

/**
 * The organization already has a deletion request that is awaiting confirmation or scheduled.
 */
public class DeletionAlreadyPendingException extends BrayfordException {

    public static final String CODE = "deletion-already-pending";

    private final String organizationId;
    private final String existingRequestId;
    private final DeletionStatus existingStatus;

    public DeletionAlreadyPendingException(
            String organizationId, String existingRequestId, DeletionStatus existingStatus) {
        super(String.format("Organization %s already has a deletion request (%s, %s)",
                organizationId, existingRequestId, existingStatus.value()));
        this.organizationId = organizationId;
        this.existingRequestId = existingRequestId;
        this.existingStatus = existingStatus;
    }

    public String organizationId() {
        return organizationId;
    }

    public String existingRequestId() {
        return existingRequestId;
    }

    public DeletionStatus existingStatus() {
        return existingStatus;
    }

    @Override
    public String errorCode() {
        return CODE;
    }
}
