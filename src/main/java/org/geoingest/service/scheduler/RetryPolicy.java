package org.geoingest.service.scheduler;

import org.geoingest.models.enums.BackoffMode;
import org.geoingest.models.enums.UpdateFrequency;

import java.time.Duration;

/**
 * How many consecutive failures a task may accumulate and how long it waits before retrying.
 * With {@code scaledByFrequency} the retry budget comes from the source's update frequency
 * instead of {@code maxRetries}.
 */
public record RetryPolicy(int maxRetries, Duration backoff, BackoffMode mode, Duration maxBackoff,
                          boolean scaledByFrequency) {

    public RetryPolicy {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1, got " + maxRetries);
        }
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be a non-negative duration");
        }
        mode = mode == null ? BackoffMode.FIXED : mode;
        maxBackoff = maxBackoff == null || maxBackoff.compareTo(backoff) < 0 ? backoff : maxBackoff;
    }

    public RetryPolicy(int maxRetries, Duration backoff, BackoffMode mode, Duration maxBackoff) {
        this(maxRetries, backoff, mode, maxBackoff, false);
    }

    public static RetryPolicy fixed(int maxRetries, Duration backoff) {
        return new RetryPolicy(maxRetries, backoff, BackoffMode.FIXED, backoff);
    }

    public int maxRetriesFor(UpdateFrequency frequency) {
        return scaledByFrequency ? frequency.suggestedMaxRetries() : maxRetries;
    }

    /** Delay before the attempt following the given (already incremented) retry count. */
    public Duration nextDelay(int retryCount) {
        if (mode == BackoffMode.FIXED || retryCount <= 1) {
            return backoff;
        }
        int doublings = Math.min(retryCount - 1, 20);
        Duration delay = backoff.multipliedBy(1L << doublings);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }
}
