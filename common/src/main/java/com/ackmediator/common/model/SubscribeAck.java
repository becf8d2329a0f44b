package com.ackmediator.common.model;

import com.ackmediator.common.command.Subscribe;

/**
 * Confirms that a consumption pipeline is running for the subscribe request
 */
public class SubscribeAck {
    private final Subscribe subscribe;

    public SubscribeAck(Subscribe subscribe) {
        this.subscribe = subscribe;
    }

    public Subscribe getSubscribe() {
        return subscribe;
    }

    @Override
    public String toString() {
        return "SubscribeAck{" + subscribe.getKey() + "}";
    }
}
