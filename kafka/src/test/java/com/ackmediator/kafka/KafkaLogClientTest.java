package com.ackmediator.kafka;

import com.ackmediator.common.api.CommittableRecord;
import com.ackmediator.common.api.CommittableSource;
import com.ackmediator.common.exception.ConsumerException;
import com.ackmediator.common.exception.ErrorCode;
import com.ackmediator.common.exception.PublishException;
import com.ackmediator.common.model.PublishAck;
import com.ackmediator.common.model.SerializedMessage;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class KafkaLogClientTest {

    private static final String TOPIC = "orders";
    private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);

    private MockConsumer<byte[], byte[]> consumer;
    private MockProducer<byte[], byte[]> producer;
    private KafkaLogClient client;
    private CommittableSource source;

    @BeforeEach
    void setUp() {
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        producer = new MockProducer<>(true, new ByteArraySerializer(), new ByteArraySerializer());
        client = new KafkaLogClient("localhost:9092", Duration.ofMillis(20), 16,
                props -> consumer, props -> producer);
    }

    @AfterEach
    void tearDown() {
        if (source != null) {
            source.close();
        }
        client.close();
    }

    @Test
    void testProduceWritesManifestHeader() throws Exception {
        SerializedMessage message = new SerializedMessage("order-placed", "{\"id\":1}".getBytes(StandardCharsets.UTF_8));

        PublishAck ack = client.produce(TOPIC, "order-1", message).get(5, TimeUnit.SECONDS);

        assertEquals(TOPIC, ack.getTopic());
        assertEquals(0, ack.getOffset());

        List<ProducerRecord<byte[], byte[]>> sent = producer.history();
        assertEquals(1, sent.size());
        assertEquals("order-1", new String(sent.get(0).key(), StandardCharsets.UTF_8));
        assertEquals("order-placed", new String(
                sent.get(0).headers().lastHeader(KafkaLogClient.MANIFEST_HEADER).value(), StandardCharsets.UTF_8));
    }

    @Test
    void testProduceFailureCompletesExceptionally() {
        MockProducer<byte[], byte[]> failing = new MockProducer<>(false, new ByteArraySerializer(), new ByteArraySerializer());
        KafkaLogClient failingClient = new KafkaLogClient("localhost:9092", Duration.ofMillis(20), 16,
                props -> consumer, props -> failing);

        CompletableFuture<PublishAck> future = failingClient.produce(TOPIC, null,
                new SerializedMessage("m", new byte[]{1}));
        failing.errorNext(new KafkaException("broker down"));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertEquals(ErrorCode.PUBLISH_SEND_FAILED, ((PublishException) ex.getCause()).getErrorCode());
        failingClient.close();
    }

    @Test
    void testSubscribeDisablesAutoCommit() {
        assertEquals(false, client.consumerProperties("billing").get("enable.auto.commit"));
        assertEquals("earliest", client.consumerProperties("billing").get("auto.offset.reset"));
        assertEquals("billing", client.consumerProperties("billing").get("group.id"));
    }

    @Test
    void testRecordsArriveInOrderAndCommitNextOffset() throws Exception {
        consumer.schedulePollTask(() -> {
            consumer.rebalance(Collections.singletonList(PARTITION));
            consumer.updateBeginningOffsets(Collections.singletonMap(PARTITION, 0L));
            consumer.addRecord(record(0, "first"));
            consumer.addRecord(record(1, "second"));
        });

        source = client.subscribe("billing", Set.of(TOPIC));

        CommittableRecord first = next(source);
        CommittableRecord second = next(source);

        assertEquals(0, first.getRecord().getOffset());
        assertEquals("order-placed", first.getRecord().getManifest());
        assertEquals("first", new String(first.getRecord().getValue(), StandardCharsets.UTF_8));
        assertEquals(1, second.getRecord().getOffset());

        first.commit().get(5, TimeUnit.SECONDS);

        assertEquals(1L, consumer.committed(Set.of(PARTITION)).get(PARTITION).offset());
    }

    @Test
    void testCommitHandleUsableOnce() throws Exception {
        consumer.schedulePollTask(() -> {
            consumer.rebalance(Collections.singletonList(PARTITION));
            consumer.updateBeginningOffsets(Collections.singletonMap(PARTITION, 0L));
            consumer.addRecord(record(0, "only"));
        });

        source = client.subscribe("billing", Set.of(TOPIC));
        CommittableRecord record = next(source);

        record.commit().get(5, TimeUnit.SECONDS);
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> record.commit().get(5, TimeUnit.SECONDS));

        assertEquals(ErrorCode.CONSUMER_OFFSET_ALREADY_COMMITTED, ((ConsumerException) ex.getCause()).getErrorCode());
    }

    @Test
    void testCloseStopsSource() throws Exception {
        source = client.subscribe("billing", Set.of(TOPIC));

        source.close();
        source.whenShutdown().get(5, TimeUnit.SECONDS);

        assertFalse(source.isOpen());
        assertTrue(consumer.closed());
    }

    @Test
    void testPollFailureEndsStream() throws Exception {
        consumer.setPollException(new KafkaException("fetch failed"));

        source = client.subscribe("billing", Set.of(TOPIC));

        assertThrows(ExecutionException.class, () -> source.whenShutdown().get(5, TimeUnit.SECONDS));
        ConsumerException ex = assertThrows(ConsumerException.class, () -> source.poll(Duration.ofMillis(10)));
        assertEquals(ErrorCode.LOG_STREAM_FAILED, ex.getErrorCode());
        assertFalse(source.isOpen());
    }

    @Test
    void testSubscribeAfterCloseFails() {
        client.close();

        ConsumerException ex = assertThrows(ConsumerException.class,
                () -> client.subscribe("billing", Set.of(TOPIC)));
        assertEquals(ErrorCode.LOG_CLIENT_CLOSED, ex.getErrorCode());
    }

    private static ConsumerRecord<byte[], byte[]> record(long offset, String value) {
        ConsumerRecord<byte[], byte[]> record = new ConsumerRecord<>(TOPIC, 0, offset,
                "key".getBytes(StandardCharsets.UTF_8), value.getBytes(StandardCharsets.UTF_8));
        record.headers().add(KafkaLogClient.MANIFEST_HEADER, "order-placed".getBytes(StandardCharsets.UTF_8));
        return record;
    }

    private static CommittableRecord next(CommittableSource source) throws Exception {
        Optional<CommittableRecord> record = source.poll(Duration.ofSeconds(5));
        assertTrue(record.isPresent(), "expected a record within 5s");
        return record.get();
    }
}
