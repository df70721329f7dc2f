package com.brayford.lifecycle.port;

import com.brayford.lifecycle.notification.DeletionNotification;

/**
 * Outbound channel for deletion emails. Delivery is best-effort: callers log failures and carry
 * on, so a failed send never rolls back a state transition.
 */
public interface DeletionNotifier {

    void send(DeletionNotification notification);
}
