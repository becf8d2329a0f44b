package com.ackmediator.common.command;

import com.ackmediator.common.model.SubscriptionKey;

import java.util.Set;

/**
 * Stop the consumption pipeline for a group and topic set
 */
public class Unsubscribe implements MediatorCommand {
    private final SubscriptionKey key;

    public Unsubscribe(String group, Set<String> topics) {
        this.key = new SubscriptionKey(group, topics);
    }

    public SubscriptionKey getKey() {
        return key;
    }

    @Override
    public String toString() {
        return "Unsubscribe{" + key + "}";
    }
}
