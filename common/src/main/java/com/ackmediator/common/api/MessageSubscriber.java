package com.ackmediator.common.api;

import java.util.concurrent.CompletionStage;

/**
 * Receives decoded messages one at a time.
 * The returned stage completes with the reply token: the subscription's acknowledge token,
 * its retry token, or anything else (treated as a failure).
 */
@FunctionalInterface
public interface MessageSubscriber {

    /**
     * Handle one message
     *
     * @param message The decoded payload
     * @return Stage completing with the reply token
     */
    CompletionStage<Object> onMessage(Object message);
}
