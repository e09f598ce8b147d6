package org.geoingest.models.enums;

import java.time.Duration;

/**
 * How often a source publishes new data. {@link #offset()} is the delay between a completed
 * collection and the next one. {@link #suggestedMaxRetries()} shrinks as the cadence slows.
 */
public enum UpdateFrequency {
    REAL_TIME(Duration.ofMinutes(1), 5),
    HIGH_FREQUENCY(Duration.ofMinutes(15), 4),
    HOURLY(Duration.ofHours(1), 3),
    THREE_HOURLY(Duration.ofHours(3), 3),
    SIX_HOURLY(Duration.ofHours(6), 2),
    DAILY(Duration.ofDays(1), 2),
    WEEKLY(Duration.ofDays(7), 1),
    MONTHLY(Duration.ofDays(30), 1),
    SEASONAL(Duration.ofDays(90), 1),
    ANNUAL(Duration.ofDays(365), 1),
    IRREGULAR(Duration.ofDays(1), 2);

    private final Duration offset;
    private final int suggestedMaxRetries;

    UpdateFrequency(Duration offset, int suggestedMaxRetries) {
        this.offset = offset;
        this.suggestedMaxRetries = suggestedMaxRetries;
    }

    public Duration offset() {
        return offset;
    }

    public int suggestedMaxRetries() {
        return suggestedMaxRetries;
    }
}
