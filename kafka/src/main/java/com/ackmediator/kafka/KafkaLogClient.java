package com.ackmediator.kafka;

import com.ackmediator.common.api.CommittableSource;
import com.ackmediator.common.api.LogClient;
import com.ackmediator.common.exception.ConsumerException;
import com.ackmediator.common.exception.ErrorCode;
import com.ackmediator.common.exception.PublishException;
import com.ackmediator.common.model.PublishAck;
import com.ackmediator.common.model.SerializedMessage;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * {@link LogClient} backed by Apache Kafka.
 *
 * Every subscription gets its own {@link Consumer} with auto-commit disabled, so offsets move only
 * through {@link com.ackmediator.common.api.CommittableRecord#commit()}. One producer is shared by
 * all publishers and created on first use.
 */
public class KafkaLogClient implements LogClient, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KafkaLogClient.class);

    /** Record header carrying the codec manifest */
    public static final String MANIFEST_HEADER = "manifest";

    private static final Duration PRODUCER_CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private final String bootstrapServers;
    private final Duration pollTimeout;
    private final int bufferCapacity;
    private final Function<Map<String, Object>, Consumer<byte[], byte[]>> consumerFactory;
    private final Function<Map<String, Object>, Producer<byte[], byte[]>> producerFactory;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Producer<byte[], byte[]> producer;

    public KafkaLogClient(String bootstrapServers, Duration pollTimeout, int bufferCapacity) {
        this(bootstrapServers, pollTimeout, bufferCapacity,
                props -> new KafkaConsumer<>(props, new ByteArrayDeserializer(), new ByteArrayDeserializer()),
                props -> new KafkaProducer<>(props, new ByteArraySerializer(), new ByteArraySerializer()));
    }

    public KafkaLogClient(String bootstrapServers, Duration pollTimeout, int bufferCapacity,
                          Function<Map<String, Object>, Consumer<byte[], byte[]>> consumerFactory,
                          Function<Map<String, Object>, Producer<byte[], byte[]>> producerFactory) {
        this.bootstrapServers = bootstrapServers;
        this.pollTimeout = pollTimeout;
        this.bufferCapacity = bufferCapacity;
        this.consumerFactory = consumerFactory;
        this.producerFactory = producerFactory;
    }

    @Override
    public CommittableSource subscribe(String group, Set<String> topics) throws ConsumerException {
        if (closed.get()) {
            throw new ConsumerException(ErrorCode.LOG_CLIENT_CLOSED, "Kafka log client closed")
                    .withGroup(group)
                    .withTopics(topics);
        }

        try {
            Consumer<byte[], byte[]> consumer = consumerFactory.apply(consumerProperties(group));
            KafkaCommittableSource source = new KafkaCommittableSource(
                    group, new LinkedHashSet<>(topics), consumer, pollTimeout, bufferCapacity);
            source.start();
            return source;
        } catch (RuntimeException e) {
            throw ConsumerException.subscriptionFailed(group, topics, e);
        }
    }

    @Override
    public CompletableFuture<PublishAck> produce(String topic, String key, SerializedMessage message) {
        CompletableFuture<PublishAck> result = new CompletableFuture<>();
        if (closed.get()) {
            result.completeExceptionally(PublishException.closed(topic));
            return result;
        }

        try {
            byte[] keyBytes = key != null ? key.getBytes(StandardCharsets.UTF_8) : null;
            ProducerRecord<byte[], byte[]> record = new ProducerRecord<>(topic, keyBytes, message.getPayload());
            if (message.hasManifest()) {
                record.headers().add(MANIFEST_HEADER, message.getManifest().getBytes(StandardCharsets.UTF_8));
            }

            producer().send(record, (metadata, error) -> {
                if (error != null) {
                    result.completeExceptionally(PublishException.sendFailed(topic, error));
                } else {
                    log.debug("Produced record, topic={}, partition={}, offset={}",
                            metadata.topic(), metadata.partition(), metadata.offset());
                    result.complete(new PublishAck(metadata.topic(), metadata.partition(), metadata.offset()));
                }
            });
        } catch (RuntimeException e) {
            result.completeExceptionally(PublishException.sendFailed(topic, e));
        }
        return result;
    }

    private Producer<byte[], byte[]> producer() {
        Producer<byte[], byte[]> current = producer;
        if (current == null) {
            synchronized (this) {
                current = producer;
                if (current == null) {
                    current = producerFactory.apply(producerProperties());
                    producer = current;
                    log.info("Created Kafka producer, bootstrapServers={}", bootstrapServers);
                }
            }
        }
        return current;
    }

    Map<String, Object> consumerProperties(String group) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, group);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        return props;
    }

    Map<String, Object> producerProperties() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        return props;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Producer<byte[], byte[]> current = producer;
        if (current != null) {
            try {
                current.close(PRODUCER_CLOSE_TIMEOUT);
            } catch (Exception e) {
                log.warn("Error closing Kafka producer", e);
            }
        }
        log.info("Kafka log client closed");
    }
}
