package com.hailmary.refresh;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of the materialized view refresher for the status surface.
 */
@Value
@Builder
public class RefresherStatus {

    String view;
    boolean enabled;
    boolean healthy;
    Instant lastCheckAt;
    Instant lastRefreshAt;
    long refreshCount;
    long skippedCount;
    String lastError;
    long errorCount;
}
