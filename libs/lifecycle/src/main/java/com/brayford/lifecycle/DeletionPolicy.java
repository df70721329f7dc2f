package com.brayford.lifecycle;

import java.time.Duration;

/**
 * The three clocks of the deletion lifecycle.
 *
 * @param tokenTtl    how long the emailed confirmation link stays valid
 * @param gracePeriod time between confirmation and permanent deletion
 * @param undoWindow  how long after confirmation the deletion may still be undone
 */
public record DeletionPolicy(Duration tokenTtl, Duration gracePeriod, Duration undoWindow) {

    public static final Duration DEFAULT_TOKEN_TTL = Duration.ofHours(24);
    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofDays(28);
    public static final Duration DEFAULT_UNDO_WINDOW = Duration.ofHours(24);

    public DeletionPolicy {
        requirePositive(tokenTtl, "tokenTtl");
        requirePositive(gracePeriod, "gracePeriod");
        requirePositive(undoWindow, "undoWindow");
        if (undoWindow.compareTo(gracePeriod) > 0) {
            throw new IllegalArgumentException("undoWindow must not be longer than gracePeriod");
        }
    }

    /** 24 hours to confirm, 28 days of grace, 24 hours to undo. */
    public static DeletionPolicy defaults() {
        return new DeletionPolicy(DEFAULT_TOKEN_TTL, DEFAULT_GRACE_PERIOD, DEFAULT_UNDO_WINDOW);
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
