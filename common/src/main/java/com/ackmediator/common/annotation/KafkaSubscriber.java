package com.ackmediator.common.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@code MessageSubscriber} bean to be subscribed at application startup, either on the bean class
 * or on the factory method producing it. String values accept {@code ${property:default}} placeholders.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface KafkaSubscriber {

    /**
     * Consumer group ID
     */
    String group();

    /**
     * Topics to subscribe to; a single entry may hold a comma separated list
     */
    String[] topics();

    /**
     * Acknowledge timeout in milliseconds, -1 uses {@code kafka.acknowledge-timeout}
     */
    long acknowledgeTimeoutMs() default -1;

    /**
     * Delivery attempts per message, -1 uses {@code kafka.retry-attempts}
     */
    int retryAttempts() default -1;

    /**
     * Backoff before the first retry; doubles for every following one
     */
    long minBackoffMs() default 1000;

    /**
     * Upper bound for a single backoff delay
     */
    long maxBackoffMs() default 300000;
}
