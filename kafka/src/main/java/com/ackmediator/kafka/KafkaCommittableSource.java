package com.ackmediator.kafka;

import com.ackmediator.common.api.CommittableRecord;
import com.ackmediator.common.api.CommittableSource;
import com.ackmediator.common.exception.ConsumerException;
import com.ackmediator.common.exception.ErrorCode;
import com.ackmediator.common.model.LogRecord;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Committable record stream over a {@link Consumer}.
 *
 * The consumer is not thread-safe, so it lives on one poll thread: records are buffered for
 * {@link #poll(Duration)}, commits requested from other threads are queued and issued from the
 * poll loop. The assignment is paused while the buffer sits above its high-water mark.
 */
public class KafkaCommittableSource implements CommittableSource {
    private static final Logger log = LoggerFactory.getLogger(KafkaCommittableSource.class);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final String group;
    private final Set<String> topics;
    private final Consumer<byte[], byte[]> consumer;
    private final Duration pollTimeout;
    private final int highWatermark;

    private final BlockingQueue<CommittableRecord> buffer = new LinkedBlockingQueue<>();
    private final Queue<PendingCommit> pendingCommits = new ConcurrentLinkedQueue<>();
    private final CompletableFuture<Void> shutdown = new CompletableFuture<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ExecutorService pollThread;

    private volatile boolean finished;
    private volatile Throwable failure;
    private boolean paused;   // poll thread only

    public KafkaCommittableSource(String group, Set<String> topics, Consumer<byte[], byte[]> consumer,
                                  Duration pollTimeout, int highWatermark) {
        this.group = group;
        this.topics = Collections.unmodifiableSet(topics);
        this.consumer = consumer;
        this.pollTimeout = pollTimeout;
        this.highWatermark = Math.max(1, highWatermark);
        this.pollThread = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "kafka-source-" + group);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Subscribe the consumer and start the poll loop
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Starting Kafka source, group={}, topics={}", group, topics);
            pollThread.execute(this::pollLoop);
            pollThread.shutdown();
        }
    }

    private void pollLoop() {
        try {
            consumer.subscribe(topics);

            while (running.get()) {
                issueCommits();
                applyBackPressure();

                ConsumerRecords<byte[], byte[]> records = consumer.poll(pollTimeout);
                for (ConsumerRecord<byte[], byte[]> record : records) {
                    buffer.add(new KafkaCommittableRecord(toLogRecord(record)));
                }

                if (!records.isEmpty()) {
                    log.debug("Fetched {} records, group={}, buffered={}", records.count(), group, buffer.size());
                }
            }
        } catch (WakeupException e) {
            if (running.get()) {
                failure = e;
                log.error("Unexpected wakeup of Kafka consumer, group={}", group, e);
            }
        } catch (Exception e) {
            failure = e;
            log.error("Kafka source failed, group={}, topics={}", group, topics, e);
        } finally {
            running.set(false);
            finished = true;
            closeConsumer();
            failPendingCommits();

            if (failure != null) {
                shutdown.completeExceptionally(failure);
            } else {
                shutdown.complete(null);
            }
            log.info("Kafka source stopped, group={}, topics={}", group, topics);
        }
    }

    private void issueCommits() {
        PendingCommit pending;
        while ((pending = pendingCommits.poll()) != null) {
            PendingCommit commit = pending;
            TopicPartition partition = new TopicPartition(commit.record.getTopic(), commit.record.getPartition());
            // Kafka stores the next offset to read
            OffsetAndMetadata next = new OffsetAndMetadata(commit.record.getOffset() + 1);

            consumer.commitAsync(Collections.singletonMap(partition, next), (offsets, error) -> {
                if (error != null) {
                    commit.future.completeExceptionally(ConsumerException.offsetCommitFailed(
                            commit.record.getTopic(), commit.record.getPartition(), commit.record.getOffset(), error));
                } else {
                    log.debug("Committed offset={}, partition={}, group={}", next.offset(), partition, group);
                    commit.future.complete(null);
                }
            });
        }
    }

    private void applyBackPressure() {
        int buffered = buffer.size();
        if (buffered >= highWatermark) {
            consumer.pause(consumer.assignment());
            if (!paused) {
                log.debug("Pausing fetch, group={}, buffered={}", group, buffered);
                paused = true;
            }
        } else if (paused && buffered <= highWatermark / 2) {
            consumer.resume(consumer.paused());
            paused = false;
            log.debug("Resuming fetch, group={}, buffered={}", group, buffered);
        }
    }

    private void closeConsumer() {
        try {
            consumer.close(CLOSE_TIMEOUT);
        } catch (Exception e) {
            log.warn("Error closing Kafka consumer, group={}", group, e);
        }
    }

    private void failPendingCommits() {
        PendingCommit pending;
        while ((pending = pendingCommits.poll()) != null) {
            ConsumerException ex = ConsumerException.offsetCommitFailed(
                    pending.record.getTopic(), pending.record.getPartition(), pending.record.getOffset(),
                    new IllegalStateException("Kafka source closed"));
            pending.future.completeExceptionally(ex);
        }
    }

    @Override
    public Optional<CommittableRecord> poll(Duration timeout) throws ConsumerException, InterruptedException {
        CommittableRecord record = buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (record != null) {
            return Optional.of(record);
        }
        if (finished && failure != null && buffer.isEmpty()) {
            throw ConsumerException.streamFailed(group, failure);
        }
        return Optional.empty();
    }

    @Override
    public boolean isOpen() {
        return !(finished && buffer.isEmpty());
    }

    @Override
    public CompletableFuture<Void> whenShutdown() {
        return shutdown;
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Closing Kafka source, group={}, topics={}", group, topics);
            consumer.wakeup();
        }
    }

    private static LogRecord toLogRecord(ConsumerRecord<byte[], byte[]> record) {
        Header manifestHeader = record.headers().lastHeader(KafkaLogClient.MANIFEST_HEADER);
        String manifest = manifestHeader != null && manifestHeader.value() != null
                ? new String(manifestHeader.value(), StandardCharsets.UTF_8)
                : null;

        return new LogRecord(
                record.topic(),
                record.partition(),
                record.offset(),
                record.key(),
                record.value(),
                manifest,
                Instant.ofEpochMilli(record.timestamp()));
    }

    private static final class PendingCommit {
        final LogRecord record;
        final CompletableFuture<Void> future = new CompletableFuture<>();

        PendingCommit(LogRecord record) {
            this.record = record;
        }
    }

    private final class KafkaCommittableRecord implements CommittableRecord {
        private final LogRecord record;
        private final AtomicBoolean committed = new AtomicBoolean(false);

        KafkaCommittableRecord(LogRecord record) {
            this.record = record;
        }

        @Override
        public LogRecord getRecord() {
            return record;
        }

        @Override
        public CompletableFuture<Void> commit() {
            if (!committed.compareAndSet(false, true)) {
                ConsumerException ex = new ConsumerException(
                        ErrorCode.CONSUMER_OFFSET_ALREADY_COMMITTED,
                        "Commit handle already used for offset " + record.getOffset());
                return CompletableFuture.failedFuture(ex);
            }

            PendingCommit pending = new PendingCommit(record);
            pendingCommits.add(pending);
            if (finished) {
                failPendingCommits();
            }
            return pending.future;
        }
    }
}
