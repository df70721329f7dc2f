package com.brayford.lifecycle.notification;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders the human-facing parts of deletion emails: timestamps in the display zone and the
 * confirmation and undo links.
 */
public final class NotificationFormatter {

    private static final String DATE_PATTERN = "d MMMM yyyy, HH:mm";

    private final String appUrl;
    private final DateTimeFormatter dateFormatter;

    /**
     * @param appUrl      base URL of the web app, without trailing slash
     * @param displayZone zone timestamps are shown in
     */
    public NotificationFormatter(String appUrl, ZoneId displayZone) {
        this.appUrl = appUrl.endsWith("/") ? appUrl.substring(0, appUrl.length() - 1) : appUrl;
        this.dateFormatter = DateTimeFormatter.ofPattern(DATE_PATTERN, Locale.UK).withZone(displayZone);
    }

    /** e.g. "2 February 2026, 10:00" */
    public String formatInstant(Instant instant) {
        return dateFormatter.format(instant);
    }

    public String confirmationLink(String requestId, String token) {
        return appUrl + "/delete-organization/confirm?requestId=" + encode(requestId) + "&token=" + encode(token);
    }

    public String undoLink(String requestId, String token) {
        return appUrl + "/delete-organization/undo?requestId=" + encode(requestId) + "&token=" + encode(token);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
