package com.brayford.lifecycle.port;

import com.brayford.lifecycle.DeletionRequest;
import com.brayford.lifecycle.DeletionStatus;

import java.util.Optional;

/**
 * Persistence for deletion requests.
 *
 * <p>Each organization has at most one <em>current</em> request: the latest one created for it.
 * Older requests stay readable by id. Both write operations are compare-and-swap; a {@code false}
 * return means another writer got there first and the caller should re-read.
 */
public interface DeletionRequestStore {

    Optional<DeletionRequest> findById(String requestId);

    /** The latest request created for the organization, whatever its status. */
    Optional<DeletionRequest> findCurrentForOrganization(String organizationId);

    /**
     * Stores a new request and makes it the organization's current one, provided the
     * organization's current request id still equals {@code expectedCurrentRequestId}.
     *
     * @param expectedCurrentRequestId id of the request the caller saw as current, or null if it
     *                                 saw none
     * @return true if stored, false if the current request changed in the meantime
     */
    boolean create(DeletionRequest request, String expectedCurrentRequestId);

    /**
     * Replaces the stored request with {@code updated} only if the stored copy still has
     * {@code expectedStatus} and the version immediately before {@code updated.version()}.
     *
     * @return true if replaced, false on a lost race
     */
    boolean replaceIfStatus(DeletionStatus expectedStatus, DeletionRequest updated);
}
