package com.ackmediator.mediator.consumer;

/**
 * Notified once when a {@link ConsumptionPipeline} has terminated and released its resources
 */
@FunctionalInterface
public interface PipelineTerminationListener {

    /**
     * @param pipeline The terminated pipeline
     * @param cause Why it stopped, null for a normal stop or end of stream
     */
    void onTerminated(ConsumptionPipeline pipeline, Throwable cause);
}
