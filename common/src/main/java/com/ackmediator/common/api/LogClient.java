package com.ackmediator.common.api;

import com.ackmediator.common.exception.ConsumerException;
import com.ackmediator.common.model.PublishAck;
import com.ackmediator.common.model.SerializedMessage;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Partitioned, offset-addressed log.
 * Implementations: KafkaLogClient
 */
public interface LogClient {

    /**
     * Open a committable read stream for a consumer group.
     * Groups without a committed offset start from the earliest record.
     *
     * @param group Consumer group
     * @param topics Fully qualified (already prefixed) topic names
     * @return Source of records, each carrying its own commit handle
     * @throws ConsumerException if the stream cannot be opened
     */
    CommittableSource subscribe(String group, Set<String> topics) throws ConsumerException;

    /**
     * Produce one record
     *
     * @param topic Fully qualified topic name
     * @param key Optional key, may be null
     * @param message Encoded value and manifest
     * @return Future completing once the log has stored the record
     */
    CompletableFuture<PublishAck> produce(String topic, String key, SerializedMessage message);
}
