package com.ackmediator.mediator;

import com.ackmediator.codec.JsonMessageCodec;
import com.ackmediator.common.api.LogClient;
import com.ackmediator.common.api.MessageCodec;
import com.ackmediator.kafka.KafkaLogClient;
import com.ackmediator.mediator.config.MediatorConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the Kafka log client, the JSON codec and a fallback meter registry
 */
@Factory
public class MediatorFactory {
    private static final Logger log = LoggerFactory.getLogger(MediatorFactory.class);

    // Records buffered per source before fetching pauses
    private static final int SOURCE_BUFFER_HIGH_WATERMARK = 256;

    @Singleton
    @Bean(preDestroy = "close")
    @Requires(missingBeans = LogClient.class)
    public KafkaLogClient logClient(MediatorConfig config) {
        log.info("Creating Kafka log client, bootstrapServers={}", config.getBootstrapServers());
        return new KafkaLogClient(config.getBootstrapServers(), config.getPollTimeout(), SOURCE_BUFFER_HIGH_WATERMARK);
    }

    @Singleton
    @Requires(missingBeans = MessageCodec.class)
    public JsonMessageCodec messageCodec() {
        return new JsonMessageCodec();
    }

    @Singleton
    @Requires(missingBeans = MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
