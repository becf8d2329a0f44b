package com.ackmediator.common.model;

/**
 * Position the log assigned to a published message
 */
public class PublishAck {
    private final String topic;
    private final int partition;
    private final long offset;

    public PublishAck(String topic, int partition, long offset) {
        this.topic = topic;
        this.partition = partition;
        this.offset = offset;
    }

    public String getTopic() {
        return topic;
    }

    public int getPartition() {
        return partition;
    }

    public long getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return String.format("PublishAck{topic=%s, partition=%d, offset=%d}", topic, partition, offset);
    }
}
