package com.ackmediator.mediator.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivery, commit and publish counters for the mediator
 */
@Singleton
public class MediatorMetrics {
    private static final Logger log = LoggerFactory.getLogger(MediatorMetrics.class);

    private final Counter deliveries;
    private final Counter acknowledged;
    private final Counter retries;
    private final Counter exhausted;
    private final Counter failed;
    private final Counter decodeErrors;
    private final Counter commits;
    private final Counter commitFailures;
    private final Counter published;
    private final Counter publishFailures;

    private final AtomicLong activeConsumptionPipelines = new AtomicLong(0);
    private final AtomicLong activePublishingPipelines = new AtomicLong(0);

    public MediatorMetrics(MeterRegistry registry) {
        this.deliveries = Counter.builder("mediator.deliveries")
                .description("Messages handed to a delivery dealer")
                .register(registry);

        this.acknowledged = Counter.builder("mediator.deliveries.acknowledged")
                .description("Deliveries acknowledged by the subscriber")
                .register(registry);

        this.retries = Counter.builder("mediator.deliveries.retries")
                .description("Delivery attempts that timed out or were asked to retry")
                .register(registry);

        this.exhausted = Counter.builder("mediator.deliveries.exhausted")
                .description("Deliveries that ran out of attempts")
                .register(registry);

        this.failed = Counter.builder("mediator.deliveries.failed")
                .description("Deliveries failed by an unexpected reply, a subscriber error or cancellation")
                .register(registry);

        this.decodeErrors = Counter.builder("mediator.decode.errors")
                .description("Records that could not be decoded")
                .register(registry);

        this.commits = Counter.builder("mediator.commits")
                .description("Offsets committed after acknowledgement")
                .register(registry);

        this.commitFailures = Counter.builder("mediator.commits.failed")
                .description("Offset commits that failed")
                .register(registry);

        this.published = Counter.builder("mediator.published")
                .description("Messages stored by the log")
                .register(registry);

        this.publishFailures = Counter.builder("mediator.published.failed")
                .description("Publish requests that failed")
                .register(registry);

        Gauge.builder("mediator.pipelines.consumption", activeConsumptionPipelines, AtomicLong::get)
                .description("Live consumption pipelines")
                .register(registry);

        Gauge.builder("mediator.pipelines.publishing", activePublishingPipelines, AtomicLong::get)
                .description("Live publishing pipelines")
                .register(registry);

        log.info("MediatorMetrics initialized");
    }

    /**
     * Metrics on a private registry
     */
    public static MediatorMetrics detached() {
        return new MediatorMetrics(new SimpleMeterRegistry());
    }

    public void recordDelivery() {
        deliveries.increment();
    }

    public void recordAcknowledged() {
        acknowledged.increment();
    }

    public void recordRetry() {
        retries.increment();
    }

    public void recordExhausted() {
        exhausted.increment();
    }

    public void recordFailed() {
        failed.increment();
    }

    public void recordDecodeError() {
        decodeErrors.increment();
    }

    public void recordCommit() {
        commits.increment();
    }

    public void recordCommitFailure() {
        commitFailures.increment();
    }

    public void recordPublished() {
        published.increment();
    }

    public void recordPublishFailure() {
        publishFailures.increment();
    }

    public void consumptionPipelineStarted() {
        activeConsumptionPipelines.incrementAndGet();
    }

    public void consumptionPipelineStopped() {
        activeConsumptionPipelines.decrementAndGet();
    }

    public void publishingPipelineStarted() {
        activePublishingPipelines.incrementAndGet();
    }

    public void publishingPipelineStopped() {
        activePublishingPipelines.decrementAndGet();
    }

    public double getAcknowledgedCount() {
        return acknowledged.count();
    }

    public double getCommitCount() {
        return commits.count();
    }

    public double getDecodeErrorCount() {
        return decodeErrors.count();
    }

    public double getExhaustedCount() {
        return exhausted.count();
    }

    public double getRetryCount() {
        return retries.count();
    }

    public long getActiveConsumptionPipelines() {
        return activeConsumptionPipelines.get();
    }

    public long getActivePublishingPipelines() {
        return activePublishingPipelines.get();
    }
}
