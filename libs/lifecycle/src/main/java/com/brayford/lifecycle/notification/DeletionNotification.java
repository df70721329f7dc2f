package com.brayford.lifecycle.notification;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An email the deletion flow wants delivered. Each variant names its template and carries the
 * values the template renders.
 */
public sealed interface DeletionNotification
        permits DeletionNotification.Confirm, DeletionNotification.Alert, DeletionNotification.Complete {

    String recipient();

    String organizationId();

    String templateAlias();

    Map<String, Object> templateData();

    /** Sent to the requester with the confirmation link. */
    record Confirm(
            String recipient,
            String organizationId,
            String organizationName,
            String userName,
            String confirmationLink,
            String expiresAt) implements DeletionNotification {

        public static final String TEMPLATE = "organization-deletion-confirm";

        @Override
        public String templateAlias() {
            return TEMPLATE;
        }

        @Override
        public Map<String, Object> templateData() {
            var data = new LinkedHashMap<String, Object>();
            data.put("organizationName", organizationName);
            data.put("userName", userName);
            data.put("confirmationLink", confirmationLink);
            data.put("expiresAt", expiresAt);
            return data;
        }
    }

    /** Sent to every other member allowed to delete the organization once deletion is confirmed. */
    record Alert(
            String recipient,
            String organizationId,
            String organizationName,
            String confirmedBy,
            String scheduledDeletionAt,
            String undoLink,
            String undoExpiresAt) implements DeletionNotification {

        public static final String TEMPLATE = "organization-deletion-alert";

        @Override
        public String templateAlias() {
            return TEMPLATE;
        }

        @Override
        public Map<String, Object> templateData() {
            var data = new LinkedHashMap<String, Object>();
            data.put("organizationName", organizationName);
            data.put("confirmedBy", confirmedBy);
            data.put("scheduledDeletionAt", scheduledDeletionAt);
            data.put("undoLink", undoLink);
            data.put("undoExpiresAt", undoExpiresAt);
            return data;
        }
    }

    /** Sent to every former member after permanent deletion. */
    record Complete(
            String recipient,
            String organizationId,
            String organizationName,
            String deletedAt) implements DeletionNotification {

        public static final String TEMPLATE = "organization-deletion-complete";

        @Override
        public String templateAlias() {
            return TEMPLATE;
        }

        @Override
        public Map<String, Object> templateData() {
            var data = new LinkedHashMap<String, Object>();
            data.put("organizationName", organizationName);
            data.put("deletedAt", deletedAt);
            return data;
        }
    }
}
