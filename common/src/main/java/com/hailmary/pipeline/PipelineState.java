package com.hailmary.pipeline;

/**
 * Lifecycle of one sync cycle.
 *
 * <pre>
 *   IDLE → POLLING → EXTRACTING → TRANSFORMING → LOADING → ADVANCING → IDLE
 * </pre>
 * {@code ERROR} is reachable from any state and returns to {@code POLLING} on the next
 * attempt after backoff.  {@code STOPPED} is terminal until the pipeline is started again.
 */
public enum PipelineState {
    IDLE,
    POLLING,
    EXTRACTING,
    TRANSFORMING,
    LOADING,
    ADVANCING,
    ERROR,
    STOPPED
}
