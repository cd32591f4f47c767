package org.batchflow.pipeline;

/**
 * Lifecycle of a {@link BatchPipeline}. Transitions only move forward:
 * {@code CREATED -> STARTED -> DRAINING -> STOPPED}, with {@code STARTED -> STOPPED} for
 * {@code stop()} and {@code CREATED -> STOPPED} for closing a pipeline that never started.
 */
public enum PipelineState {
    CREATED,
    STARTED,
    DRAINING,
    STOPPED
}
