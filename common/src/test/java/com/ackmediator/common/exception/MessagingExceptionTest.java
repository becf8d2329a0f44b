package com.ackmediator.common.exception;

import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class MessagingExceptionTest {

    @Test
    void testContextInStructuredMessage() {
        ConsumerException ex = ConsumerException.pendingQueueFull("billing", Set.of("orders"), 16);

        assertEquals(ErrorCode.CONSUMER_PENDING_QUEUE_FULL, ex.getErrorCode());
        assertEquals("billing", ex.getContext().get("group"));
        assertEquals(16, ex.getContext().get("capacity"));
        assertTrue(ex.getStructuredMessage().contains("1002"));
        assertTrue(ex.isRetriable());
    }

    @Test
    void testFromCode() {
        assertEquals(ErrorCode.DELIVERY_ATTEMPTS_EXHAUSTED, ErrorCode.fromCode(2003));
        assertEquals(ErrorCode.UNKNOWN_ERROR, ErrorCode.fromCode(12345));
    }

    @Test
    void testUnwrapCompletionWrappers() {
        DeliveryException cause = DeliveryException.cancelled();
        Throwable wrapped = new CompletionException(new ExecutionException(cause));

        assertSame(cause, ExceptionLogger.unwrap(wrapped));
    }
}
