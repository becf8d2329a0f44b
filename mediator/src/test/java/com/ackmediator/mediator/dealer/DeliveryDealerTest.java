package com.ackmediator.mediator.dealer;

import com.ackmediator.common.api.MessageSubscriber;
import com.ackmediator.common.command.Subscribe;
import com.ackmediator.common.exception.DeliveryException;
import com.ackmediator.common.exception.ErrorCode;
import com.ackmediator.common.model.LogRecord;
import com.ackmediator.common.model.PubSubSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryDealerTest {

    private VirtualScheduler scheduler;
    private RecordingListener listener;
    private List<Duration> sendTimes;
    private List<CompletableFuture<Object>> replies;

    @BeforeEach
    void setUp() {
        scheduler = new VirtualScheduler();
        listener = new RecordingListener();
        sendTimes = new ArrayList<>();
        replies = new ArrayList<>();
    }

    @Test
    void testAcknowledgeCompletesWithSuccess() {
        DeliveryDealer dealer = dealer(3, Duration.ofSeconds(2), message -> {
            sendTimes.add(scheduler.now());
            return CompletableFuture.completedFuture(PubSubSignal.ACK);
        });

        CompletableFuture<DealOutcome> outcome = dealer.deal();
        scheduler.runPending();

        assertTrue(outcome.isDone());
        assertEquals(DealOutcome.Kind.SUCCESS, outcome.join().getKind());
        assertEquals(1, listener.successes);

        // acknowledge timer is disarmed
        scheduler.advance(Duration.ofMinutes(1));
        assertEquals(1, sendTimes.size());
        assertEquals(0, scheduler.pendingTasks());
    }

    @Test
    void testNoReplyExhaustsAttemptsOnBackoffSchedule() {
        DeliveryDealer dealer = dealer(3, Duration.ofSeconds(2), pendingReply());

        CompletableFuture<DealOutcome> outcome = dealer.deal();
        scheduler.advance(Duration.ofMillis(8999));

        assertFalse(outcome.isDone());
        assertEquals(List.of(Duration.ZERO, Duration.ofSeconds(3), Duration.ofSeconds(7)), sendTimes);

        scheduler.advance(Duration.ofMillis(1));

        assertEquals(DealOutcome.Kind.ATTEMPTS_EXHAUSTED, outcome.join().getKind());
        assertEquals(Duration.ofSeconds(9), scheduler.now());
        assertEquals(1, listener.exhausted);
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), listener.retryDelays);
        assertTrue(scheduler.now().compareTo(RetryBackoff.dealTimeout(3, Duration.ofSeconds(2))) <= 0);
    }

    @Test
    void testSubscriptionBackoffStaysWithinDealTimeout() {
        DeliveryDealer dealer = dealer(3, Duration.ofSeconds(2), Duration.ofSeconds(10), pendingReply());

        CompletableFuture<DealOutcome> outcome = dealer.deal();
        scheduler.advance(Duration.ofSeconds(36));

        assertEquals(DealOutcome.Kind.ATTEMPTS_EXHAUSTED, outcome.join().getKind());
        assertEquals(List.of(Duration.ZERO, Duration.ofSeconds(12), Duration.ofSeconds(34)), sendTimes);
        assertEquals(Duration.ofSeconds(76), dealer.getDealTimeout());
        assertTrue(scheduler.now().compareTo(dealer.getDealTimeout()) <= 0);
    }

    @Test
    void testBlockedSubscriberDoesNotHoldBackTimeout() throws Exception {
        ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor();
        ExecutorService dispatcher = Executors.newSingleThreadExecutor();
        CountDownLatch release = new CountDownLatch(1);
        MessageSubscriber blocking = message -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return CompletableFuture.completedFuture(PubSubSignal.ACK);
        };
        Subscribe subscription = new Subscribe("billing", Set.of("orders"), blocking, Duration.ofMillis(200), 1);

        try {
            DeliveryDealer dealer = new DeliveryDealer(message(), subscription, timers, dispatcher, listener);
            DealOutcome result = dealer.deal().get(2, TimeUnit.SECONDS);

            assertEquals(DealOutcome.Kind.ATTEMPTS_EXHAUSTED, result.getKind());
        } finally {
            release.countDown();
            timers.shutdownNow();
            dispatcher.shutdownNow();
        }
    }

    @Test
    void testRetryTokenResendsAfterBackoff() {
        DeliveryDealer dealer = dealer(3, Duration.ofSeconds(30), message -> {
            sendTimes.add(scheduler.now());
            Object reply = sendTimes.size() == 1 ? PubSubSignal.RETRY : PubSubSignal.ACK;
            return CompletableFuture.completedFuture(reply);
        });

        CompletableFuture<DealOutcome> outcome = dealer.deal();
        scheduler.advance(Duration.ofSeconds(5));

        assertEquals(DealOutcome.Kind.SUCCESS, outcome.join().getKind());
        assertEquals(List.of(Duration.ZERO, Duration.ofSeconds(1)), sendTimes);
        assertEquals(2, dealer.getAttemptsRemaining());
    }

    @Test
    void testUnexpectedReplyFailsWithoutRetry() {
        DeliveryDealer dealer = dealer(3, Duration.ofSeconds(2), message -> {
            sendTimes.add(scheduler.now());
            return CompletableFuture.completedFuture("maybe later");
        });

        CompletableFuture<DealOutcome> outcome = dealer.deal();
        scheduler.advance(Duration.ofMinutes(1));

        DealOutcome result = outcome.join();
        assertEquals(DealOutcome.Kind.FAILURE, result.getKind());
        assertEquals(ErrorCode.DELIVERY_UNEXPECTED_REPLY, ((DeliveryException) result.getReason()).getErrorCode());
        assertEquals(1, sendTimes.size());
        assertEquals(1, listener.failures.size());
    }

    @Test
    void testSubscriberExceptionFailsWithoutRetry() {
        DeliveryDealer dealer = dealer(3, Duration.ofSeconds(2), message -> {
            sendTimes.add(scheduler.now());
            throw new IllegalStateException("handler broke");
        });

        CompletableFuture<DealOutcome> outcome = dealer.deal();
        scheduler.advance(Duration.ofMinutes(1));

        DealOutcome result = outcome.join();
        assertEquals(DealOutcome.Kind.FAILURE, result.getKind());
        DeliveryException reason = (DeliveryException) result.getReason();
        assertEquals(ErrorCode.DELIVERY_SUBSCRIBER_FAILED, reason.getErrorCode());
        assertTrue(reason.getCause() instanceof IllegalStateException);
        assertEquals(1, sendTimes.size());
    }

    @Test
    void testExceptionalReplyFails() {
        DeliveryDealer dealer = dealer(3, Duration.ofSeconds(2),
                message -> CompletableFuture.failedFuture(new RuntimeException("downstream unavailable")));

        CompletableFuture<DealOutcome> outcome = dealer.deal();
        scheduler.runPending();

        assertEquals(DealOutcome.Kind.FAILURE, outcome.join().getKind());
        assertEquals(ErrorCode.DELIVERY_SUBSCRIBER_FAILED,
                ((DeliveryException) outcome.join().getReason()).getErrorCode());
    }

    @Test
    void testLateAcknowledgeCountsAsSuccess() {
        DeliveryDealer dealer = dealer(3, Duration.ofSeconds(2), pendingReply());

        CompletableFuture<DealOutcome> outcome = dealer.deal();
        scheduler.advance(Duration.ofMillis(2500));
        assertFalse(outcome.isDone());

        // first attempt timed out, dealer is backing off
        replies.get(0).complete(PubSubSignal.ACK);

        assertEquals(DealOutcome.Kind.SUCCESS, outcome.join().getKind());
        scheduler.advance(Duration.ofMinutes(1));
        assertEquals(1, sendTimes.size());
    }

    @Test
    void testStaleRetryIsIgnored() {
        DeliveryDealer dealer = dealer(3, Duration.ofSeconds(2), pendingReply());

        CompletableFuture<DealOutcome> outcome = dealer.deal();
        scheduler.advance(Duration.ofMillis(3500));
        assertEquals(2, sendTimes.size());

        replies.get(0).complete(PubSubSignal.RETRY);
        assertFalse(outcome.isDone());
        assertEquals(2, dealer.getAttemptsRemaining());

        replies.get(1).complete(PubSubSignal.ACK);
        assertEquals(DealOutcome.Kind.SUCCESS, outcome.join().getKind());
        assertEquals(2, sendTimes.size());
    }

    @Test
    void testSingleAttemptExhaustsOnFirstTimeout() {
        DeliveryDealer dealer = dealer(1, Duration.ofSeconds(2), pendingReply());

        CompletableFuture<DealOutcome> outcome = dealer.deal();
        scheduler.advance(Duration.ofSeconds(2));

        assertEquals(DealOutcome.Kind.ATTEMPTS_EXHAUSTED, outcome.join().getKind());
        assertEquals(1, sendTimes.size());
        assertTrue(listener.retryDelays.isEmpty());
    }

    @Test
    void testCancelDisarmsTimers() {
        DeliveryDealer dealer = dealer(3, Duration.ofSeconds(2), pendingReply());

        CompletableFuture<DealOutcome> outcome = dealer.deal();
        scheduler.runPending();
        dealer.cancel();

        DealOutcome result = outcome.join();
        assertEquals(DealOutcome.Kind.FAILURE, result.getKind());
        assertEquals(ErrorCode.DELIVERY_CANCELLED, ((DeliveryException) result.getReason()).getErrorCode());

        scheduler.advance(Duration.ofMinutes(1));
        assertEquals(1, sendTimes.size());
        assertEquals(1, listener.failures.size());

        // no signal is accepted after the terminal outcome
        replies.get(0).complete(PubSubSignal.ACK);
        assertEquals(0, listener.successes);
    }

    @Test
    void testDealTwiceSendsOnce() {
        DeliveryDealer dealer = dealer(3, Duration.ofSeconds(2), pendingReply());

        CompletableFuture<DealOutcome> first = dealer.deal();
        CompletableFuture<DealOutcome> second = dealer.deal();
        scheduler.runPending();

        assertSame(first, second);
        assertEquals(1, sendTimes.size());
    }

    private MessageSubscriber pendingReply() {
        return message -> {
            sendTimes.add(scheduler.now());
            CompletableFuture<Object> reply = new CompletableFuture<>();
            replies.add(reply);
            return reply;
        };
    }

    private DeliveryDealer dealer(int retryAttempts, Duration acknowledgeTimeout, MessageSubscriber subscriber) {
        return dealer(retryAttempts, acknowledgeTimeout, Duration.ofSeconds(1), subscriber);
    }

    private DeliveryDealer dealer(int retryAttempts, Duration acknowledgeTimeout, Duration minBackoff,
                                  MessageSubscriber subscriber) {
        Subscribe subscription = new Subscribe("billing", Set.of("orders"), subscriber,
                PubSubSignal.ACK, acknowledgeTimeout, PubSubSignal.RETRY, retryAttempts,
                minBackoff, Duration.ofMinutes(5));
        return new DeliveryDealer(message(), subscription, scheduler, listener);
    }

    private static InFlightMessage message() {
        LogRecord record = new LogRecord("orders", 0, 42L, null,
                "{}".getBytes(StandardCharsets.UTF_8), "order-placed", Instant.EPOCH);
        return new InFlightMessage(record, "order-42");
    }

    private static class RecordingListener implements DealListener {
        int successes;
        int exhausted;
        final List<Exception> failures = new ArrayList<>();
        final List<Duration> retryDelays = new ArrayList<>();

        @Override
        public void onSuccess() {
            successes++;
        }

        @Override
        public void onFailure(Exception reason) {
            failures.add(reason);
        }

        @Override
        public void onAttemptsExhausted() {
            exhausted++;
        }

        @Override
        public void onRetry(int attemptsUsed, Duration delay) {
            retryDelays.add(delay);
        }
    }
}
