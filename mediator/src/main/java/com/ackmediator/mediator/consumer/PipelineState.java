package com.ackmediator.mediator.consumer;

/**
 * Lifecycle of a {@link ConsumptionPipeline}
 */
public enum PipelineState {
    /** Subscribe requests are queued until the warm-up delay elapses */
    WARMING_UP,
    /** Waiting for the first subscribe to open the log source */
    READY,
    /** Reading, delivering and committing */
    ACTIVE,
    /** Stopped for good */
    TERMINATED;

    public boolean canTransitionTo(PipelineState next) {
        switch (this) {
            case WARMING_UP:
                return next == READY || next == TERMINATED;
            case READY:
                return next == ACTIVE || next == TERMINATED;
            case ACTIVE:
                return next == TERMINATED;
            default:
                return false;
        }
    }
}
