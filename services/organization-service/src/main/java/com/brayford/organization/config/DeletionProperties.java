package com.brayford.organization.config;

import com.brayford.lifecycle.DeletionPolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Deletion lifecycle tuning, bound from {@code brayford.deletion.*}. Every field is optional and
 * falls back to the production values.
 *
 * @param tokenTtl                validity of the emailed confirmation link (default 24h)
 * @param gracePeriod             time from confirmation to permanent deletion (default 28d)
 * @param undoWindow              time after confirmation during which undo is allowed (default 24h)
 * @param displayZone             zone used for dates in emails (default Europe/London)
 * @param maxWriteAttempts        compare-and-swap attempts before giving up (default 3)
 * @param completionSweepInterval how often due completions are looked for (default PT1M)
 */
@ConfigurationProperties(prefix = "brayford.deletion")
@Validated
public record DeletionProperties(
        Duration tokenTtl,
        Duration gracePeriod,
        Duration undoWindow,
        @NotBlank String displayZone,
        @Min(1) int maxWriteAttempts,
        Duration completionSweepInterval) {

    public DeletionProperties {
        if (tokenTtl == null) {
            tokenTtl = DeletionPolicy.DEFAULT_TOKEN_TTL;
        }
        if (gracePeriod == null) {
            gracePeriod = DeletionPolicy.DEFAULT_GRACE_PERIOD;
        }
        if (undoWindow == null) {
            undoWindow = DeletionPolicy.DEFAULT_UNDO_WINDOW;
        }
        if (displayZone == null || displayZone.isBlank()) {
            displayZone = "Europe/London";
        }
        if (maxWriteAttempts == 0) {
            maxWriteAttempts = 3;
        }
        if (completionSweepInterval == null) {
            completionSweepInterval = Duration.ofMinutes(1);
        }
    }

    /**
     * @throws IllegalArgumentException if the durations are not positive or the undo window
     *                                  outlasts the grace period
     */
    public DeletionPolicy toPolicy() {
        return new DeletionPolicy(tokenTtl, gracePeriod, undoWindow);
    }

    /**
     * @throws java.time.DateTimeException if the zone id is not recognised
     */
    public ZoneId zoneId() {
        return ZoneId.of(displayZone);
    }
}
