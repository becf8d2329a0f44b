package com.ackmediator.common.model;

/**
 * Default reply tokens a subscriber sends back for a delivered message
 */
public enum PubSubSignal {
    /**
     * Message processed, offset may be committed
     */
    ACK,

    /**
     * Deliver the same message again after the backoff delay
     */
    RETRY
}
