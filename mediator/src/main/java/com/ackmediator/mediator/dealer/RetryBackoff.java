package com.ackmediator.mediator.dealer;

import com.ackmediator.common.command.Subscribe;

import java.time.Duration;

/**
 * Exponential backoff between delivery attempts
 */
public final class RetryBackoff {

    private static final Duration DEFAULT_BASE = Duration.ofSeconds(1);
    // 2^30 already overflows any sensible max backoff
    private static final int MAX_SHIFT = 30;

    private RetryBackoff() {
    }

    /**
     * Delay before the next attempt: {@code minBackoff * 2^attemptsUsed}, capped at {@code maxBackoff}.
     *
     * @param attemptsUsed Attempts that already timed out or were asked to retry, 0 for the first retry
     */
    public static Duration retryDelay(int attemptsUsed, Duration minBackoff, Duration maxBackoff) {
        if (attemptsUsed < 0) {
            throw new IllegalArgumentException("attemptsUsed must be >= 0, was " + attemptsUsed);
        }
        int shift = Math.min(attemptsUsed, MAX_SHIFT);
        long millis;
        try {
            millis = Math.multiplyExact(minBackoff.toMillis(), 1L << shift);
        } catch (ArithmeticException e) {
            return maxBackoff;
        }
        Duration delay = Duration.ofMillis(millis);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    /**
     * Upper bound on how long one message can occupy a dealer with the default one second backoff base and
     * no cap. Subscriptions with their own backoff use {@link #dealTimeout(Subscribe)}.
     */
    public static Duration dealTimeout(int retryAttempts, Duration acknowledgeTimeout) {
        return dealTimeout(retryAttempts, acknowledgeTimeout, DEFAULT_BASE);
    }

    /**
     * Upper bound on how long one message can occupy a dealer:
     * {@code acknowledgeTimeout * retryAttempts + base * (2^retryAttempts - 1)}.
     */
    public static Duration dealTimeout(int retryAttempts, Duration acknowledgeTimeout, Duration base) {
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("retryAttempts must be >= 1, was " + retryAttempts);
        }
        int shift = Math.min(retryAttempts, MAX_SHIFT);
        return acknowledgeTimeout.multipliedBy(retryAttempts)
                .plus(base.multipliedBy((1L << shift) - 1));
    }

    /**
     * Upper bound on how long one message of this subscription can occupy a dealer
     */
    public static Duration dealTimeout(Subscribe subscription) {
        return dealTimeout(subscription.getRetryAttempts(), subscription.getAcknowledgeTimeout(),
                subscription.getMinBackoff(), subscription.getMaxBackoff());
    }

    /**
     * {@code acknowledgeTimeout * retryAttempts} plus one capped backoff delay per attempt. With
     * {@code minBackoff = 1s} and no cap reached this equals {@link #dealTimeout(int, Duration)}.
     */
    public static Duration dealTimeout(int retryAttempts, Duration acknowledgeTimeout,
                                       Duration minBackoff, Duration maxBackoff) {
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("retryAttempts must be >= 1, was " + retryAttempts);
        }
        Duration total = acknowledgeTimeout.multipliedBy(retryAttempts);
        for (int used = 0; used < retryAttempts; used++) {
            total = total.plus(retryDelay(used, minBackoff, maxBackoff));
        }
        return total;
    }
}
