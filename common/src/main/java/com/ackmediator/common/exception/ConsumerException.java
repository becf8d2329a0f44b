package com.ackmediator.common.exception;

import java.util.Set;

/**
 * Failures of a consumption pipeline: subscribing, reading the log, committing offsets
 */
public class ConsumerException extends MessagingException {

    public ConsumerException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ConsumerException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public ConsumerException withGroup(String group) {
        withContext("group", group);
        return this;
    }

    public ConsumerException withTopics(Set<String> topics) {
        withContext("topics", String.join(",", topics));
        return this;
    }

    public static ConsumerException subscriptionFailed(String group, Set<String> topics, Throwable cause) {
        return new ConsumerException(
                ErrorCode.CONSUMER_SUBSCRIPTION_FAILED,
                String.format("Subscription failed: group=%s topics=%s", group, topics),
                cause)
                .withGroup(group)
                .withTopics(topics);
    }

    public static ConsumerException pendingQueueFull(String group, Set<String> topics, int capacity) {
        ConsumerException ex = new ConsumerException(
                ErrorCode.CONSUMER_PENDING_QUEUE_FULL,
                String.format("Pending subscribe queue full: group=%s topics=%s", group, topics))
                .withGroup(group)
                .withTopics(topics);
        ex.withContext("capacity", capacity);
        return ex;
    }

    public static ConsumerException terminated(String group, Set<String> topics) {
        return new ConsumerException(
                ErrorCode.CONSUMER_PIPELINE_TERMINATED,
                String.format("Consumption pipeline terminated: group=%s topics=%s", group, topics))
                .withGroup(group)
                .withTopics(topics);
    }

    public static ConsumerException offsetCommitFailed(String topic, int partition, long offset, Throwable cause) {
        ConsumerException ex = new ConsumerException(
                ErrorCode.CONSUMER_OFFSET_COMMIT_FAILED,
                String.format("Offset commit failed: topic=%s partition=%d offset=%d", topic, partition, offset),
                cause);
        ex.withContext("topic", topic);
        ex.withContext("partition", partition);
        ex.withContext("offset", offset);
        return ex;
    }

    public static ConsumerException streamFailed(String group, Throwable cause) {
        return new ConsumerException(
                ErrorCode.LOG_STREAM_FAILED,
                "Log read stream failed for group " + group,
                cause)
                .withGroup(group);
    }
}
