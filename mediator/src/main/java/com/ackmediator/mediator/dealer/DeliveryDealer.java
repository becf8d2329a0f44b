package com.ackmediator.mediator.dealer;

import com.ackmediator.common.api.MessageSubscriber;
import com.ackmediator.common.command.Subscribe;
import com.ackmediator.common.exception.DeliveryException;
import com.ackmediator.common.exception.ExceptionLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Delivers one message to a subscriber until it is acknowledged.
 *
 * Each attempt sends the message and arms the acknowledge timer. The acknowledge token completes the
 * deal, the retry token or a timeout schedules another attempt after an exponential backoff, anything
 * else fails it at once. Replies are matched to their attempt number so a late reply cannot restart a
 * timer that belongs to a newer attempt.
 *
 * Timers run on the scheduler, the subscriber is called on the dispatcher. A subscriber that blocks a
 * dispatcher thread therefore cannot hold back its own acknowledge timeout.
 */
public class DeliveryDealer {
    private static final Logger log = LoggerFactory.getLogger(DeliveryDealer.class);

    private enum State {
        CREATED,
        AWAITING_REPLY,
        BACKING_OFF,
        DONE
    }

    private final InFlightMessage message;
    private final MessageSubscriber subscriber;
    private final Object acknowledgeMsg;
    private final Object retryMsg;
    private final Duration acknowledgeTimeout;
    private final int retryAttempts;
    private final Duration minBackoff;
    private final Duration maxBackoff;
    private final ScheduledExecutorService scheduler;
    private final Executor dispatcher;
    private final DealListener listener;
    private final CompletableFuture<DealOutcome> outcome = new CompletableFuture<>();

    // Guarded by this
    private State state = State.CREATED;
    private int attemptsRemaining;
    private int attempt;
    private ScheduledFuture<?> timer;

    public DeliveryDealer(InFlightMessage message, Subscribe subscription,
                          ScheduledExecutorService scheduler, DealListener listener) {
        this(message, subscription, scheduler, scheduler, listener);
    }

    public DeliveryDealer(InFlightMessage message, Subscribe subscription, ScheduledExecutorService scheduler,
                          Executor dispatcher, DealListener listener) {
        this.message = message;
        this.subscriber = subscription.getSubscriber();
        this.acknowledgeMsg = subscription.getAcknowledgeMsg();
        this.retryMsg = subscription.getRetryMsg();
        this.acknowledgeTimeout = subscription.getAcknowledgeTimeout();
        this.retryAttempts = subscription.getRetryAttempts();
        this.minBackoff = subscription.getMinBackoff();
        this.maxBackoff = subscription.getMaxBackoff();
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.listener = listener != null ? listener : DealListener.NO_OP;
        this.attemptsRemaining = retryAttempts;
    }

    /**
     * Start delivering. Calling it again returns the same outcome without resending.
     */
    public CompletableFuture<DealOutcome> deal() {
        synchronized (this) {
            if (state != State.CREATED) {
                return outcome;
            }
            send();
        }
        return outcome;
    }

    /**
     * Stop delivering; completes with a cancelled {@link DealOutcome.Kind#FAILURE} unless already done
     */
    public void cancel() {
        DealOutcome result;
        synchronized (this) {
            if (state == State.DONE) {
                return;
            }
            log.debug("Cancelling delivery of {}", message);
            result = finish(DealOutcome.failure(DeliveryException.cancelled()));
        }
        publish(result);
    }

    public CompletableFuture<DealOutcome> outcome() {
        return outcome;
    }

    public InFlightMessage getMessage() {
        return message;
    }

    /**
     * Longest this dealer can take to reach an outcome with its subscription's timeout and backoff
     */
    public Duration getDealTimeout() {
        return RetryBackoff.dealTimeout(retryAttempts, acknowledgeTimeout, minBackoff, maxBackoff);
    }

    public synchronized int getAttemptsRemaining() {
        return attemptsRemaining;
    }

    public synchronized boolean isDone() {
        return state == State.DONE;
    }

    // Requires lock
    private void send() {
        attempt++;
        int current = attempt;
        state = State.AWAITING_REPLY;
        timer = scheduler.schedule(() -> onTimeout(current), acknowledgeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Sending {} attempt={}, attemptsRemaining={}", message, current, attemptsRemaining);
        dispatcher.execute(() -> invokeSubscriber(current));
    }

    private void invokeSubscriber(int sentAttempt) {
        CompletionStage<Object> reply;
        try {
            reply = subscriber.onMessage(message.getPayload());
        } catch (Exception e) {
            onSubscriberError(sentAttempt, e);
            return;
        }

        if (reply == null) {
            onSubscriberError(sentAttempt, new IllegalStateException("Subscriber returned no reply"));
            return;
        }

        reply.whenComplete((value, error) -> {
            if (error != null) {
                onSubscriberError(sentAttempt, ExceptionLogger.unwrap(error));
            } else {
                onReply(sentAttempt, value);
            }
        });
    }

    private void onReply(int repliedAttempt, Object reply) {
        DealOutcome result = null;
        synchronized (this) {
            if (state == State.DONE) {
                log.debug("Reply {} after delivery finished, {}", reply, message);
                return;
            }

            boolean current = repliedAttempt == attempt && state == State.AWAITING_REPLY;
            if (Objects.equals(reply, acknowledgeMsg)) {
                if (!current) {
                    log.debug("Late acknowledge for attempt {} accepted, {}", repliedAttempt, message);
                }
                result = finish(DealOutcome.success());
            } else if (!current) {
                log.debug("Ignoring stale reply {} for attempt {}, current={}", reply, repliedAttempt, attempt);
            } else if (Objects.equals(reply, retryMsg)) {
                log.debug("Subscriber asked to retry {}", message);
                result = retry();
            } else {
                result = finish(DealOutcome.failure(DeliveryException.unexpectedReply(reply, attempt)));
            }
        }
        publish(result);
    }

    private void onSubscriberError(int failedAttempt, Throwable error) {
        DealOutcome result;
        synchronized (this) {
            if (state == State.DONE || failedAttempt != attempt || state != State.AWAITING_REPLY) {
                log.debug("Ignoring subscriber failure for attempt {}, {}: {}", failedAttempt, message, error.toString());
                return;
            }
            result = finish(DealOutcome.failure(DeliveryException.subscriberFailed(attempt, error)));
        }
        publish(result);
    }

    private void onTimeout(int timedOutAttempt) {
        DealOutcome result;
        synchronized (this) {
            if (state != State.AWAITING_REPLY || timedOutAttempt != attempt) {
                return;
            }
            log.debug("No acknowledge within {} for {}, attempt={}", acknowledgeTimeout, message, timedOutAttempt);
            result = retry();
        }
        publish(result);
    }

    // Requires lock
    private DealOutcome retry() {
        cancelTimer();
        int used = attemptsUsed();
        attemptsRemaining--;
        if (attemptsRemaining <= 0) {
            return finish(DealOutcome.attemptsExhausted());
        }

        Duration delay = RetryBackoff.retryDelay(used, minBackoff, maxBackoff);
        state = State.BACKING_OFF;
        timer = scheduler.schedule(this::resend, delay.toMillis(), TimeUnit.MILLISECONDS);
        notifyRetry(used, delay);
        return null;
    }

    private synchronized void resend() {
        if (state == State.BACKING_OFF) {
            send();
        }
    }

    // Requires lock
    private DealOutcome finish(DealOutcome result) {
        state = State.DONE;
        cancelTimer();
        return result;
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }

    private int attemptsUsed() {
        return retryAttempts - attemptsRemaining;
    }

    private void notifyRetry(int used, Duration delay) {
        try {
            listener.onRetry(used, delay);
        } catch (RuntimeException e) {
            log.warn("Deal listener failed on retry, {}", message, e);
        }
    }

    private void publish(DealOutcome result) {
        if (result == null) {
            return;
        }

        try {
            switch (result.getKind()) {
                case SUCCESS:
                    listener.onSuccess();
                    break;
                case ATTEMPTS_EXHAUSTED:
                    listener.onAttemptsExhausted();
                    break;
                default:
                    listener.onFailure(result.getReason());
                    break;
            }
        } catch (RuntimeException e) {
            log.error("Deal listener failed on {}, {}", result.getKind(), message, e);
        }
        outcome.complete(result);
    }
}
