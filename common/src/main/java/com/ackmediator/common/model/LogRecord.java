package com.ackmediator.common.model;

import java.time.Instant;

/**
 * One record read from the log, as the consumption pipeline sees it
 */
public class LogRecord {
    private final String topic;
    private final int partition;
    private final long offset;
    private final byte[] key;      // may be null
    private final byte[] value;
    private final String manifest; // may be null when the producer sent none
    private final Instant timestamp;

    public LogRecord(String topic, int partition, long offset, byte[] key, byte[] value,
                     String manifest, Instant timestamp) {
        this.topic = topic;
        this.partition = partition;
        this.offset = offset;
        this.key = key;
        this.value = value;
        this.manifest = manifest;
        this.timestamp = timestamp;
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

    public byte[] getKey() {
        return key;
    }

    public byte[] getValue() {
        return value;
    }

    public String getManifest() {
        return manifest;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public SerializedMessage toSerializedMessage() {
        return new SerializedMessage(manifest, value);
    }

    @Override
    public String toString() {
        return String.format("LogRecord{topic=%s, partition=%d, offset=%d, manifest=%s, valueLength=%d}",
                topic, partition, offset, manifest, value != null ? value.length : 0);
    }
}
