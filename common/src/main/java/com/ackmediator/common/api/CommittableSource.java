package com.ackmediator.common.api;

import com.ackmediator.common.exception.ConsumerException;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Ordered stream of records for one consumer group subscription
 */
public interface CommittableSource extends AutoCloseable {

    /**
     * Wait for the next record
     *
     * @param timeout Max time to wait
     * @return The next record, or empty if none arrived in time or the stream has ended
     * @throws ConsumerException if the underlying stream failed
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    Optional<CommittableRecord> poll(Duration timeout) throws ConsumerException, InterruptedException;

    /**
     * @return false once the stream has ended and every buffered record was handed out
     */
    boolean isOpen();

    /**
     * @return Future completing when the stream has stopped, exceptionally if it failed
     */
    CompletableFuture<Void> whenShutdown();

    /**
     * Stop reading and release the connection. Pending commits may fail afterwards.
     */
    @Override
    void close();
}
