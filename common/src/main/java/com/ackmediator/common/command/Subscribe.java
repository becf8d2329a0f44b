package com.ackmediator.common.command;

import com.ackmediator.common.api.MessageSubscriber;
import com.ackmediator.common.model.PubSubSignal;
import com.ackmediator.common.model.SubscriptionKey;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Subscribe a {@link MessageSubscriber} to a topic set within a consumer group.
 * Messages are handed over one at a time; the subscriber replies with {@code acknowledgeMsg}
 * to commit or {@code retryMsg} to get the message again after a backoff.
 */
public class Subscribe implements MediatorCommand {
    public static final Duration DEFAULT_MIN_BACKOFF = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMinutes(5);

    private final SubscriptionKey key;
    private final MessageSubscriber subscriber;
    private final Object acknowledgeMsg;
    private final Duration acknowledgeTimeout;
    private final Object retryMsg;
    private final int retryAttempts;
    private final Duration minBackoff;
    private final Duration maxBackoff;

    public Subscribe(String group, Set<String> topics, MessageSubscriber subscriber,
                     Object acknowledgeMsg, Duration acknowledgeTimeout, Object retryMsg,
                     int retryAttempts, Duration minBackoff, Duration maxBackoff) {
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("group must not be blank");
        }
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("at least one topic is required");
        }
        if (acknowledgeTimeout == null || acknowledgeTimeout.isZero() || acknowledgeTimeout.isNegative()) {
            throw new IllegalArgumentException("acknowledgeTimeout must be positive");
        }
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("retryAttempts must be at least 1, was " + retryAttempts);
        }
        if (minBackoff == null || maxBackoff == null || minBackoff.isNegative() || maxBackoff.compareTo(minBackoff) < 0) {
            throw new IllegalArgumentException("backoff must satisfy 0 <= minBackoff <= maxBackoff");
        }
        this.key = new SubscriptionKey(group, topics);
        this.subscriber = Objects.requireNonNull(subscriber, "subscriber");
        this.acknowledgeMsg = Objects.requireNonNull(acknowledgeMsg, "acknowledgeMsg");
        this.acknowledgeTimeout = acknowledgeTimeout;
        this.retryMsg = Objects.requireNonNull(retryMsg, "retryMsg");
        this.retryAttempts = retryAttempts;
        this.minBackoff = minBackoff;
        this.maxBackoff = maxBackoff;
    }

    /**
     * Uses {@link PubSubSignal#ACK} / {@link PubSubSignal#RETRY} as tokens and the default backoff range
     */
    public Subscribe(String group, Set<String> topics, MessageSubscriber subscriber,
                     Duration acknowledgeTimeout, int retryAttempts) {
        this(group, topics, subscriber, PubSubSignal.ACK, acknowledgeTimeout, PubSubSignal.RETRY,
                retryAttempts, DEFAULT_MIN_BACKOFF, DEFAULT_MAX_BACKOFF);
    }

    public SubscriptionKey getKey() {
        return key;
    }

    public String getGroup() {
        return key.getGroup();
    }

    public Set<String> getTopics() {
        return key.getTopics();
    }

    public MessageSubscriber getSubscriber() {
        return subscriber;
    }

    public Object getAcknowledgeMsg() {
        return acknowledgeMsg;
    }

    public Duration getAcknowledgeTimeout() {
        return acknowledgeTimeout;
    }

    public Object getRetryMsg() {
        return retryMsg;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public Duration getMinBackoff() {
        return minBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    @Override
    public String toString() {
        return String.format("Subscribe{group=%s, topics=%s, acknowledgeTimeout=%s, retryAttempts=%d}",
                key.getGroup(), key.getTopics(), acknowledgeTimeout, retryAttempts);
    }
}
