package com.ackmediator.mediator.config;

import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Settings for the log connection and the consumption pipelines
 */
@Singleton
public class MediatorConfig {
    private static final Logger log = LoggerFactory.getLogger(MediatorConfig.class);

    private final String bootstrapServers;
    private final String topicPrefix;
    private final Duration acknowledgeTimeout;
    private final int retryAttempts;
    private final Duration warmUp;
    private final int maxInFlight;
    private final int pendingCapacity;
    private final Duration pollTimeout;
    private final Duration shutdownTimeout;
    private final boolean resumeOnDecodeError;

    @Inject
    public MediatorConfig(
            @Value("${kafka.bootstrap-servers:localhost:9092}") String bootstrapServers,
            @Value("${kafka.topic-prefix:}") String topicPrefix,
            @Value("${kafka.acknowledge-timeout:30s}") Duration acknowledgeTimeout,
            @Value("${kafka.retry-attempts:3}") int retryAttempts,
            @Value("${kafka.consumer.warm-up:10s}") Duration warmUp,
            @Value("${kafka.consumer.max-in-flight:2}") int maxInFlight,
            @Value("${kafka.consumer.pending-capacity:16}") int pendingCapacity,
            @Value("${kafka.consumer.poll-timeout:500ms}") Duration pollTimeout,
            @Value("${kafka.consumer.shutdown-timeout:20s}") Duration shutdownTimeout,
            @Value("${kafka.consumer.resume-on-decode-error:true}") boolean resumeOnDecodeError) {
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("kafka.consumer.max-in-flight must be >= 1, was " + maxInFlight);
        }
        if (pendingCapacity < 1) {
            throw new IllegalArgumentException("kafka.consumer.pending-capacity must be >= 1, was " + pendingCapacity);
        }
        this.bootstrapServers = bootstrapServers;
        this.topicPrefix = topicPrefix != null ? topicPrefix : "";
        this.acknowledgeTimeout = acknowledgeTimeout;
        this.retryAttempts = retryAttempts;
        this.warmUp = warmUp;
        this.maxInFlight = maxInFlight;
        this.pendingCapacity = pendingCapacity;
        this.pollTimeout = pollTimeout;
        this.shutdownTimeout = shutdownTimeout;
        this.resumeOnDecodeError = resumeOnDecodeError;

        log.info("MediatorConfig: bootstrapServers={}, topicPrefix='{}', warmUp={}, maxInFlight={}, pendingCapacity={}",
                bootstrapServers, this.topicPrefix, warmUp, maxInFlight, pendingCapacity);
    }

    /**
     * Defaults for everything except the warm-up delay
     */
    public static MediatorConfig withWarmUp(Duration warmUp) {
        return new MediatorConfig("localhost:9092", "", Duration.ofSeconds(30), 3, warmUp,
                2, 16, Duration.ofMillis(500), Duration.ofSeconds(20), true);
    }

    public String prefixed(String topic) {
        return topicPrefix + topic;
    }

    public String getBootstrapServers() {
        return bootstrapServers;
    }

    public String getTopicPrefix() {
        return topicPrefix;
    }

    public Duration getAcknowledgeTimeout() {
        return acknowledgeTimeout;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public Duration getWarmUp() {
        return warmUp;
    }

    public int getMaxInFlight() {
        return maxInFlight;
    }

    public int getPendingCapacity() {
        return pendingCapacity;
    }

    public Duration getPollTimeout() {
        return pollTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public boolean isResumeOnDecodeError() {
        return resumeOnDecodeError;
    }
}
