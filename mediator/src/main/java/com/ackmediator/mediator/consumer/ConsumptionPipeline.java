package com.ackmediator.mediator.consumer;

import com.ackmediator.common.api.CommittableRecord;
import com.ackmediator.common.api.CommittableSource;
import com.ackmediator.common.api.LogClient;
import com.ackmediator.common.api.MessageCodec;
import com.ackmediator.common.command.Subscribe;
import com.ackmediator.common.exception.ConsumerException;
import com.ackmediator.common.exception.DecodeException;
import com.ackmediator.common.exception.DeliveryException;
import com.ackmediator.common.exception.ErrorCode;
import com.ackmediator.common.exception.ExceptionLogger;
import com.ackmediator.common.model.LogRecord;
import com.ackmediator.common.model.SubscribeAck;
import com.ackmediator.common.model.SubscriptionKey;
import com.ackmediator.mediator.config.MediatorConfig;
import com.ackmediator.mediator.dealer.DealListener;
import com.ackmediator.mediator.dealer.DeliveryDealer;
import com.ackmediator.mediator.dealer.InFlightMessage;
import com.ackmediator.mediator.dealer.RetryBackoff;
import com.ackmediator.mediator.metrics.MediatorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reads one consumer group subscription from the log and delivers every record through a
 * {@link DeliveryDealer}, committing its offset only once the subscriber acknowledged it.
 *
 * Subscribe requests are queued while the pipeline warms up. The first request after warm-up opens the
 * source; later requests for the same key are acknowledged without a second subscription. At most
 * {@code max-in-flight} records are being dealt at once, the read loop blocks until a slot frees up.
 */
public class ConsumptionPipeline {
    private static final Logger log = LoggerFactory.getLogger(ConsumptionPipeline.class);

    private final SubscriptionKey key;
    private final LogClient logClient;
    private final MessageCodec codec;
    private final MediatorConfig config;
    private final MediatorMetrics metrics;
    private final PipelineTerminationListener terminationListener;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService dispatcher;
    private final ExecutorService readLoop;
    private final Semaphore inFlight;
    private final Set<DeliveryDealer> dealers = ConcurrentHashMap.newKeySet();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();
    private volatile Subscribe subscription;

    // Guarded by this
    private PipelineState state = PipelineState.WARMING_UP;
    private final Deque<PendingSubscribe> pending = new ArrayDeque<>();
    private CommittableSource source;
    private boolean started;

    public ConsumptionPipeline(SubscriptionKey key, LogClient logClient, MessageCodec codec, MediatorConfig config,
                               MediatorMetrics metrics, PipelineTerminationListener terminationListener) {
        this.key = key;
        this.logClient = logClient;
        this.codec = codec;
        this.config = config;
        this.metrics = metrics;
        this.terminationListener = terminationListener;
        this.inFlight = new Semaphore(config.getMaxInFlight());

        String name = key.name();
        // Timers get their own thread so a subscriber blocking a dealer thread cannot stall its timeout
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name + "-timer");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger dealerThreads = new AtomicInteger();
        this.dispatcher = Executors.newFixedThreadPool(config.getMaxInFlight(), r -> {
            Thread t = new Thread(r, name + "-dealer-" + dealerThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.readLoop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name + "-reader");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the warm-up timer
     */
    public void start() {
        synchronized (this) {
            if (started || state != PipelineState.WARMING_UP) {
                return;
            }
            started = true;
        }
        metrics.consumptionPipelineStarted();
        Duration warmUp = config.getWarmUp();
        log.info("Starting consumption pipeline {}, warmUp={}", key.name(), warmUp);
        scheduler.schedule(this::onWarmUpElapsed, warmUp.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Register a subscription. Completes once the read loop runs, or at once if it already does.
     */
    public synchronized CompletableFuture<SubscribeAck> subscribe(Subscribe request) {
        if (!key.equals(request.getKey())) {
            ConsumerException ex = new ConsumerException(ErrorCode.VALIDATION_INVALID_SUBSCRIPTION,
                    "Subscription " + request.getKey() + " does not belong to pipeline " + key)
                    .withGroup(request.getGroup())
                    .withTopics(request.getTopics());
            return CompletableFuture.failedFuture(ex);
        }

        switch (state) {
            case WARMING_UP:
                return enqueue(request);
            case READY:
                return activate(request);
            case ACTIVE:
                log.warn("Pipeline {} already subscribed, acknowledging duplicate subscribe", key.name());
                return CompletableFuture.completedFuture(new SubscribeAck(request));
            default:
                return CompletableFuture.failedFuture(ConsumerException.terminated(key.getGroup(), key.getTopics()));
        }
    }

    private CompletableFuture<SubscribeAck> enqueue(Subscribe request) {
        if (pending.size() >= config.getPendingCapacity()) {
            ConsumerException ex = ConsumerException.pendingQueueFull(
                    key.getGroup(), key.getTopics(), config.getPendingCapacity());
            ExceptionLogger.logWarn(log, ex);
            return CompletableFuture.failedFuture(ex);
        }
        PendingSubscribe entry = new PendingSubscribe(request);
        pending.add(entry);
        log.debug("Queued subscribe during warm-up, pipeline={}, queued={}", key.name(), pending.size());
        return entry.future;
    }

    private synchronized void onWarmUpElapsed() {
        if (!transition(PipelineState.READY)) {
            return;
        }
        log.info("Pipeline {} warmed up, replaying {} subscribe requests", key.name(), pending.size());

        List<PendingSubscribe> replay = new ArrayList<>(pending);
        pending.clear();
        for (PendingSubscribe entry : replay) {
            subscribe(entry.request).whenComplete((ack, error) -> {
                if (error != null) {
                    entry.future.completeExceptionally(error);
                } else {
                    entry.future.complete(ack);
                }
            });
        }
    }

    // Requires lock
    private CompletableFuture<SubscribeAck> activate(Subscribe request) {
        Set<String> topics = new LinkedHashSet<>();
        for (String topic : request.getTopics()) {
            topics.add(config.prefixed(topic));
        }

        try {
            source = logClient.subscribe(request.getGroup(), topics);
        } catch (ConsumerException e) {
            ExceptionLogger.logError(log, e);
            terminate(e);
            return CompletableFuture.failedFuture(e);
        } catch (RuntimeException e) {
            ConsumerException ex = ConsumerException.subscriptionFailed(request.getGroup(), topics, e);
            ExceptionLogger.logError(log, ex);
            terminate(ex);
            return CompletableFuture.failedFuture(ex);
        }

        subscription = request;
        transition(PipelineState.ACTIVE);
        readLoop.execute(this::runReadLoop);
        log.info("Pipeline {} active, group={}, topics={}, dealTimeout={}", key.name(), request.getGroup(), topics,
                RetryBackoff.dealTimeout(request));
        return CompletableFuture.completedFuture(new SubscribeAck(request));
    }

    private void runReadLoop() {
        CommittableSource current;
        synchronized (this) {
            current = source;
        }

        try {
            while (isActive()) {
                Optional<CommittableRecord> next = current.poll(config.getPollTimeout());
                if (next.isEmpty()) {
                    if (!current.isOpen()) {
                        log.info("Log stream of pipeline {} completed", key.name());
                        terminate(null);
                        return;
                    }
                    continue;
                }

                CommittableRecord record = next.get();
                DecodeResult decoded = decode(record.getRecord());
                switch (decoded.getStatus()) {
                    case OK:
                        deliver(record, decoded.getMessage());
                        break;
                    case DECODE_ERROR:
                        metrics.recordDecodeError();
                        if (config.isResumeOnDecodeError()) {
                            log.warn("Skipping undecodable record {}: {}", record.getRecord(), decoded.getError().getMessage());
                        } else {
                            log.error("Stopping pipeline {} on undecodable record {}", key.name(), record.getRecord(),
                                    decoded.getError());
                            terminate(decoded.getError());
                            return;
                        }
                        break;
                    default:
                        log.error("Fatal error decoding {}, stopping pipeline {}", record.getRecord(), key.name(),
                                decoded.getError());
                        terminate(decoded.getError());
                        return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Read loop of pipeline {} interrupted", key.name());
        } catch (ConsumerException e) {
            ExceptionLogger.logError(log, e);
            terminate(e);
        } catch (RuntimeException e) {
            log.error("Read loop of pipeline {} failed", key.name(), e);
            terminate(e);
        }
    }

    private DecodeResult decode(LogRecord record) {
        try {
            return DecodeResult.ok(codec.decode(record.toSerializedMessage()));
        } catch (DecodeException e) {
            return DecodeResult.decodeError(e);
        } catch (RuntimeException e) {
            return DecodeResult.fatal(e);
        }
    }

    private void deliver(CommittableRecord record, Object payload) throws InterruptedException {
        inFlight.acquire();

        InFlightMessage message = new InFlightMessage(record.getRecord(), payload);
        DeliveryDealer dealer = new DeliveryDealer(message, subscription, scheduler, dispatcher,
                new CommitOnAcknowledge(record));
        dealers.add(dealer);
        dealer.outcome().whenComplete((outcome, error) -> {
            dealers.remove(dealer);
            inFlight.release();
        });

        if (!isActive()) {
            dealer.cancel();
            return;
        }
        metrics.recordDelivery();
        dealer.deal();
    }

    /**
     * Stop the pipeline. In-flight deliveries are cancelled without committing.
     *
     * @return Future completing once resources are released
     */
    public CompletableFuture<Void> stop() {
        terminate(null);
        return terminated;
    }

    private void terminate(Throwable cause) {
        List<PendingSubscribe> toFail;
        CommittableSource toClose;
        synchronized (this) {
            if (!transition(PipelineState.TERMINATED)) {
                return;
            }
            toFail = new ArrayList<>(pending);
            pending.clear();
            toClose = source;
        }

        if (cause != null) {
            log.warn("Terminating pipeline {}: {}", key.name(), cause.toString());
        } else {
            log.info("Terminating pipeline {}", key.name());
        }

        for (DeliveryDealer dealer : new ArrayList<>(dealers)) {
            dealer.cancel();
        }
        for (PendingSubscribe entry : toFail) {
            entry.future.completeExceptionally(ConsumerException.terminated(key.getGroup(), key.getTopics()));
        }

        if (toClose == null) {
            release(cause);
            return;
        }

        toClose.close();
        toClose.whenShutdown()
                .orTimeout(config.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        ExceptionLogger.logFailure(log, "Log source of pipeline " + key.name() + " did not close cleanly", error);
                    }
                    release(cause);
                });
    }

    private void release(Throwable cause) {
        readLoop.shutdownNow();
        scheduler.shutdownNow();
        dispatcher.shutdownNow();

        boolean wasStarted;
        synchronized (this) {
            wasStarted = started;
        }
        if (wasStarted) {
            metrics.consumptionPipelineStopped();
        }

        log.info("Pipeline {} terminated", key.name());
        try {
            terminationListener.onTerminated(this, cause);
        } catch (RuntimeException e) {
            log.error("Termination listener of pipeline {} failed", key.name(), e);
        }
        terminated.complete(null);
    }

    // Requires lock
    private boolean transition(PipelineState next) {
        if (!state.canTransitionTo(next)) {
            return false;
        }
        log.debug("Pipeline {} {} -> {}", key.name(), state, next);
        state = next;
        return true;
    }

    private synchronized boolean isActive() {
        return state == PipelineState.ACTIVE;
    }

    public synchronized PipelineState getState() {
        return state;
    }

    public synchronized boolean isTerminated() {
        return state == PipelineState.TERMINATED;
    }

    public SubscriptionKey getKey() {
        return key;
    }

    public int getInFlightCount() {
        return dealers.size();
    }

    public CompletableFuture<Void> whenTerminated() {
        return terminated;
    }

    @Override
    public String toString() {
        return "ConsumptionPipeline{" + key.name() + ", state=" + getState() + "}";
    }

    private final class CommitOnAcknowledge implements DealListener {
        private final CommittableRecord record;

        CommitOnAcknowledge(CommittableRecord record) {
            this.record = record;
        }

        @Override
        public void onSuccess() {
            metrics.recordAcknowledged();
            if (!isActive()) {
                log.debug("Pipeline {} stopped, not committing {}", key.name(), record.getRecord());
                return;
            }

            LogRecord acked = record.getRecord();
            record.commit().whenComplete((ignored, error) -> {
                if (error != null) {
                    metrics.recordCommitFailure();
                    ExceptionLogger.logFailure(log, "Offset commit failed for " + acked, error);
                } else {
                    metrics.recordCommit();
                    log.debug("Committed topic={}, partition={}, offset={}",
                            acked.getTopic(), acked.getPartition(), acked.getOffset());
                }
            });
        }

        @Override
        public void onFailure(Exception reason) {
            if (reason instanceof DeliveryException
                    && ((DeliveryException) reason).getErrorCode() == ErrorCode.DELIVERY_CANCELLED) {
                log.debug("Delivery of {} cancelled", record.getRecord());
                return;
            }
            metrics.recordFailed();
            log.warn("Delivery of {} failed, offset not committed: {}", record.getRecord(), reason.toString());
        }

        @Override
        public void onAttemptsExhausted() {
            metrics.recordExhausted();
            LogRecord failed = record.getRecord();
            DeliveryException ex = DeliveryException.attemptsExhausted(subscription.getRetryAttempts());
            ex.withContext("topic", failed.getTopic());
            ex.withContext("partition", failed.getPartition());
            ex.withContext("offset", failed.getOffset());
            ExceptionLogger.logConditional(log, ex);
        }

        @Override
        public void onRetry(int attemptsUsed, Duration delay) {
            metrics.recordRetry();
        }
    }

    private static final class PendingSubscribe {
        final Subscribe request;
        final CompletableFuture<SubscribeAck> future = new CompletableFuture<>();

        PendingSubscribe(Subscribe request) {
            this.request = request;
        }
    }
}
