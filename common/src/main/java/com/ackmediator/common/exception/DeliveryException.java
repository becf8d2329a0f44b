package com.ackmediator.common.exception;

/**
 * Permanent failure to get one message acknowledged
 */
public class DeliveryException extends MessagingException {

    public DeliveryException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public DeliveryException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static DeliveryException unexpectedReply(Object reply, int attemptsUsed) {
        DeliveryException ex = new DeliveryException(
                ErrorCode.DELIVERY_UNEXPECTED_REPLY,
                String.format("Failed to receive acknowledge, after %d attempts: reply=%s", attemptsUsed, reply));
        ex.withContext("attemptsUsed", attemptsUsed);
        return ex;
    }

    public static DeliveryException subscriberFailed(int attemptsUsed, Throwable cause) {
        DeliveryException ex = new DeliveryException(
                ErrorCode.DELIVERY_SUBSCRIBER_FAILED,
                String.format("Subscriber failed, after %d attempts", attemptsUsed),
                cause);
        ex.withContext("attemptsUsed", attemptsUsed);
        return ex;
    }

    public static DeliveryException attemptsExhausted(int retryAttempts) {
        DeliveryException ex = new DeliveryException(
                ErrorCode.DELIVERY_ATTEMPTS_EXHAUSTED,
                String.format("Max attempts reached: %d", retryAttempts));
        ex.withContext("retryAttempts", retryAttempts);
        return ex;
    }

    public static DeliveryException cancelled() {
        return new DeliveryException(ErrorCode.DELIVERY_CANCELLED, "Delivery cancelled by pipeline shutdown");
    }
}
