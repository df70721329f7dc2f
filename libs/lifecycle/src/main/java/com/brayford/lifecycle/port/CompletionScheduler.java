package com.brayford.lifecycle.port;

import java.time.Instant;

/**
 * Arranges for completion to be attempted for a request at or after a given time.
 *
 * <p>Triggers may fire late, early or more than once; completion itself re-checks state and time.
 */
public interface CompletionScheduler {

    void scheduleCompletion(String requestId, Instant dueAt);

    /** Drops a pending trigger, e.g. after an undo. Unknown ids are ignored. */
    void cancelCompletion(String requestId);
}
