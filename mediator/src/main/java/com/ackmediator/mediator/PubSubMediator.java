package com.ackmediator.mediator;

import com.ackmediator.common.api.LogClient;
import com.ackmediator.common.api.MessageCodec;
import com.ackmediator.common.api.MessageSubscriber;
import com.ackmediator.common.command.MediatorCommand;
import com.ackmediator.common.command.Publish;
import com.ackmediator.common.command.Subscribe;
import com.ackmediator.common.command.Unsubscribe;
import com.ackmediator.common.exception.ErrorCode;
import com.ackmediator.common.exception.MessagingException;
import com.ackmediator.common.model.PublishAck;
import com.ackmediator.common.model.SubscribeAck;
import com.ackmediator.common.model.SubscriptionKey;
import com.ackmediator.mediator.config.MediatorConfig;
import com.ackmediator.mediator.consumer.ConsumptionPipeline;
import com.ackmediator.mediator.metrics.MediatorMetrics;
import com.ackmediator.mediator.publisher.PublishingPipeline;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Entry point for subscribing, publishing and unsubscribing.
 *
 * Keeps one {@link ConsumptionPipeline} per group and topic set and one {@link PublishingPipeline} per
 * topic. All routing and both caches live on a single mailbox thread, so no locking is needed here.
 */
@Singleton
public class PubSubMediator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PubSubMediator.class);

    private final LogClient logClient;
    private final MessageCodec codec;
    private final MediatorConfig config;
    private final MediatorMetrics metrics;
    private final ExecutorService mailbox;

    // Mailbox thread only
    private final Map<SubscriptionKey, ConsumptionPipeline> consumers = new HashMap<>();
    private final Map<String, PublishingPipeline> publishers = new HashMap<>();

    private volatile boolean closed;

    @Inject
    public PubSubMediator(LogClient logClient, MessageCodec codec, MediatorConfig config, MediatorMetrics metrics) {
        this.logClient = logClient;
        this.codec = codec;
        this.config = config;
        this.metrics = metrics;
        this.mailbox = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "kafka-mediator");
            t.setDaemon(true);
            return t;
        });
        log.info("PubSubMediator initialized, topicPrefix='{}'", config.getTopicPrefix());
    }

    /**
     * Dispatch a {@link Subscribe}, {@link Publish} or {@link Unsubscribe}
     *
     * @return Future of the matching acknowledgement: {@link SubscribeAck}, {@link PublishAck} or null
     */
    public CompletableFuture<?> route(MediatorCommand command) {
        if (command instanceof Subscribe) {
            return subscribe((Subscribe) command);
        }
        if (command instanceof Publish) {
            return publish((Publish) command);
        }
        if (command instanceof Unsubscribe) {
            return unsubscribe((Unsubscribe) command);
        }
        String type = command == null ? "null" : command.getClass().getName();
        return CompletableFuture.failedFuture(new MessagingException(ErrorCode.MEDIATOR_UNKNOWN_COMMAND,
                "Cannot route command of type " + type));
    }

    public CompletableFuture<SubscribeAck> subscribe(String group, Set<String> topics, MessageSubscriber subscriber,
                                                     Object acknowledgeMsg, Duration acknowledgeTimeout,
                                                     Object retryMsg, int retryAttempts,
                                                     Duration minBackoff, Duration maxBackoff) {
        Subscribe request;
        try {
            request = new Subscribe(group, topics, subscriber, acknowledgeMsg, acknowledgeTimeout,
                    retryMsg, retryAttempts, minBackoff, maxBackoff);
        } catch (IllegalArgumentException | NullPointerException e) {
            return CompletableFuture.failedFuture(e);
        }
        return subscribe(request);
    }

    public CompletableFuture<SubscribeAck> subscribe(Subscribe request) {
        log.debug("Routing {}", request);
        return onMailbox(() -> consumptionPipeline(request.getKey()).subscribe(request));
    }

    public CompletableFuture<PublishAck> publish(String topic, Object message) {
        Publish request;
        try {
            request = new Publish(topic, message);
        } catch (IllegalArgumentException | NullPointerException e) {
            return CompletableFuture.failedFuture(e);
        }
        return publish(request);
    }

    public CompletableFuture<PublishAck> publish(Publish request) {
        return onMailbox(() -> publishingPipeline(request.getTopic()).publish(request));
    }

    public CompletableFuture<Void> unsubscribe(String group, Set<String> topics) {
        return unsubscribe(new Unsubscribe(group, topics));
    }

    public CompletableFuture<Void> unsubscribe(Unsubscribe request) {
        return onMailbox(() -> {
            ConsumptionPipeline pipeline = consumers.remove(request.getKey());
            if (pipeline == null) {
                log.debug("No consumption pipeline for {}", request.getKey());
                return CompletableFuture.completedFuture(null);
            }
            log.info("Unsubscribing {}", request.getKey().name());
            return pipeline.stop();
        });
    }

    /**
     * Live consumption pipeline for a key, looked up on the mailbox
     */
    public CompletableFuture<Optional<ConsumptionPipeline>> findConsumptionPipeline(SubscriptionKey key) {
        return onMailbox(() -> CompletableFuture.completedFuture(Optional.ofNullable(consumers.get(key))));
    }

    // Mailbox thread
    private ConsumptionPipeline consumptionPipeline(SubscriptionKey key) {
        ConsumptionPipeline existing = consumers.get(key);
        if (existing != null && !existing.isTerminated()) {
            return existing;
        }
        if (existing != null) {
            log.info("Replacing terminated pipeline {}", key.name());
        }

        ConsumptionPipeline pipeline = new ConsumptionPipeline(key, logClient, codec, config, metrics,
                this::onPipelineTerminated);
        consumers.put(key, pipeline);
        pipeline.start();
        return pipeline;
    }

    // Mailbox thread
    private PublishingPipeline publishingPipeline(String topic) {
        return publishers.computeIfAbsent(topic,
                t -> new PublishingPipeline(t, config.prefixed(t), logClient, codec, metrics));
    }

    private void onPipelineTerminated(ConsumptionPipeline pipeline, Throwable cause) {
        try {
            mailbox.execute(() -> {
                if (consumers.remove(pipeline.getKey(), pipeline)) {
                    log.info("Removed terminated pipeline {}", pipeline.getKey().name());
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Mediator stopped, pipeline {} not removed from cache", pipeline.getKey().name());
        }
    }

    private <T> CompletableFuture<T> onMailbox(Supplier<CompletableFuture<T>> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        if (closed) {
            result.completeExceptionally(closedException());
            return result;
        }

        try {
            mailbox.execute(() -> {
                try {
                    task.get().whenComplete((value, error) -> {
                        if (error != null) {
                            result.completeExceptionally(error);
                        } else {
                            result.complete(value);
                        }
                    });
                } catch (RuntimeException e) {
                    log.error("Mediator command failed", e);
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(closedException());
        }
        return result;
    }

    private static MessagingException closedException() {
        return new MessagingException(ErrorCode.MEDIATOR_CLOSED, "Mediator closed");
    }

    /**
     * Stop every pipeline and the mailbox. Waits up to the shutdown timeout for sources to close.
     */
    @PreDestroy
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.info("Closing PubSubMediator");

        CompletableFuture<Void> stopped = new CompletableFuture<>();
        try {
            mailbox.execute(() -> {
                List<CompletableFuture<Void>> stopping = new ArrayList<>();
                for (ConsumptionPipeline pipeline : consumers.values()) {
                    stopping.add(pipeline.stop());
                }
                consumers.clear();
                for (PublishingPipeline publisher : publishers.values()) {
                    publisher.close();
                }
                publishers.clear();
                CompletableFuture.allOf(stopping.toArray(new CompletableFuture[0]))
                        .whenComplete((ignored, error) -> stopped.complete(null));
            });
        } catch (RejectedExecutionException e) {
            stopped.complete(null);
        }
        mailbox.shutdown();

        try {
            stopped.get(config.getShutdownTimeout().plusSeconds(1).toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing PubSubMediator");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Pipelines did not stop within {}", config.getShutdownTimeout(), e);
        }
        log.info("PubSubMediator closed");
    }
}
