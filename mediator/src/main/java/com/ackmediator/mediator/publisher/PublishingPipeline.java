package com.ackmediator.mediator.publisher;

import com.ackmediator.common.api.LogClient;
import com.ackmediator.common.api.MessageCodec;
import com.ackmediator.common.command.Publish;
import com.ackmediator.common.exception.CodecException;
import com.ackmediator.common.exception.ExceptionLogger;
import com.ackmediator.common.exception.PublishException;
import com.ackmediator.common.model.PublishAck;
import com.ackmediator.common.model.SerializedMessage;
import com.ackmediator.mediator.metrics.MediatorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Encodes and produces messages for one topic. Completes exactly when the log client does, no retry.
 */
public class PublishingPipeline {
    private static final Logger log = LoggerFactory.getLogger(PublishingPipeline.class);

    private final String topic;
    private final String logTopic;
    private final LogClient logClient;
    private final MessageCodec codec;
    private final MediatorMetrics metrics;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param topic Topic as callers name it
     * @param logTopic Topic with the configured prefix applied
     */
    public PublishingPipeline(String topic, String logTopic, LogClient logClient, MessageCodec codec,
                              MediatorMetrics metrics) {
        this.topic = topic;
        this.logTopic = logTopic;
        this.logClient = logClient;
        this.codec = codec;
        this.metrics = metrics;
        metrics.publishingPipelineStarted();
        log.info("Created publishing pipeline, topic={}, logTopic={}", topic, logTopic);
    }

    public CompletableFuture<PublishAck> publish(Publish request) {
        if (closed.get()) {
            metrics.recordPublishFailure();
            return CompletableFuture.failedFuture(PublishException.closed(topic));
        }

        SerializedMessage encoded;
        try {
            encoded = codec.encode(request.getMessage());
        } catch (CodecException e) {
            PublishException ex = PublishException.encodeFailed(topic, e);
            ExceptionLogger.logError(log, ex);
            metrics.recordPublishFailure();
            return CompletableFuture.failedFuture(ex);
        }

        return logClient.produce(logTopic, request.getKey(), encoded)
                .whenComplete((ack, error) -> {
                    if (error != null) {
                        metrics.recordPublishFailure();
                        ExceptionLogger.logFailure(log, "Publish to " + logTopic + " failed", error);
                    } else {
                        metrics.recordPublished();
                        log.debug("Published to topic={}, partition={}, offset={}",
                                ack.getTopic(), ack.getPartition(), ack.getOffset());
                    }
                });
    }

    public void close() {
        if (closed.compareAndSet(false, true)) {
            metrics.publishingPipelineStopped();
            log.info("Closed publishing pipeline, topic={}", topic);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public String getTopic() {
        return topic;
    }
}
