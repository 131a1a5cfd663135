package com.hailmary.pipeline;

import com.hailmary.config.RetryConfig;

/**
 * Exponential backoff with a cap.
 *
 * <p>For the N-th consecutive failure (starting at 1) the delay is
 * {@code min(initialDelayMs * multiplier^(N-1), maxDelayMs)}.  With defaults: 1s, 2s, 4s,
 * ... capped at 60s.</p>
 */
public class BackoffPolicy {

    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double multiplier;

    public BackoffPolicy(RetryConfig config) {
        this(config.getInitialDelayMs(), config.getMaxDelayMs(), config.getMultiplier());
    }

    public BackoffPolicy(long initialDelayMs, long maxDelayMs, double multiplier) {
        if (initialDelayMs <= 0 || maxDelayMs < initialDelayMs || multiplier < 1.0) {
            throw new IllegalArgumentException("Invalid backoff: initial=" + initialDelayMs
                    + " max=" + maxDelayMs + " multiplier=" + multiplier);
        }
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
    }

    public long delayMs(int consecutiveFailures) {
        if (consecutiveFailures <= 0) {
            return 0;
        }
        double delay = initialDelayMs * Math.pow(multiplier, consecutiveFailures - 1);
        return (long) Math.min(delay, maxDelayMs);
    }
}
