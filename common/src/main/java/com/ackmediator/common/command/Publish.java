package com.ackmediator.common.command;

import java.util.Objects;

/**
 * Publish one message to a topic. The key is optional and only steers partitioning.
 */
public class Publish implements MediatorCommand {
    private final String topic;
    private final String key;
    private final Object message;

    public Publish(String topic, String key, Object message) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
        this.topic = topic;
        this.key = key;
        this.message = Objects.requireNonNull(message, "message");
    }

    public Publish(String topic, Object message) {
        this(topic, null, message);
    }

    public String getTopic() {
        return topic;
    }

    public String getKey() {
        return key;
    }

    public Object getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "Publish{topic=" + topic + ", key=" + key + ", type=" + message.getClass().getSimpleName() + "}";
    }
}
