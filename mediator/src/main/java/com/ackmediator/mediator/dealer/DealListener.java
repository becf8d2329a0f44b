package com.ackmediator.mediator.dealer;

import java.time.Duration;

/**
 * Receives the outcome of a {@link DeliveryDealer}. Exactly one of the terminal methods is called, once.
 */
public interface DealListener {

    void onSuccess();

    void onFailure(Exception reason);

    void onAttemptsExhausted();

    /**
     * An attempt timed out or was asked to retry and the message will be resent after {@code delay}
     */
    default void onRetry(int attemptsUsed, Duration delay) {
    }

    DealListener NO_OP = new DealListener() {
        @Override
        public void onSuccess() {
        }

        @Override
        public void onFailure(Exception reason) {
        }

        @Override
        public void onAttemptsExhausted() {
        }
    };
}
