package com.hailmary.config;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Exponential backoff applied after a failed cycle, and the timeout bounding every
 * blocking source query.
 *
 * <pre>
 *   delay = min(initialDelayMs * multiplier ^ (failures - 1), maxDelayMs)
 * </pre>
 */
@Data
@NoArgsConstructor
public class RetryConfig {

    private long initialDelayMs = 1_000;
    private long maxDelayMs = 60_000;
    private double multiplier = 2.0;
    private int queryTimeoutSeconds = 30;
}
