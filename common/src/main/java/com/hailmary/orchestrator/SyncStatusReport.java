package com.hailmary.orchestrator;

import com.hailmary.pipeline.PipelineStatus;
import com.hailmary.refresh.RefresherStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate health of all pipelines, the view refresher and the two stores they connect.
 */
@Value
@Builder
public class SyncStatusReport {

    Instant generatedAt;
    boolean running;
    boolean healthy;
    boolean sourceReachable;
    boolean indexReachable;
    List<PipelineStatus> pipelines;
    RefresherStatus refresher;
}
