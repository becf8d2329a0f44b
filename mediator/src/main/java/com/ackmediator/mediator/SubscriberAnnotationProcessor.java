package com.ackmediator.mediator;

import com.ackmediator.common.annotation.KafkaSubscriber;
import com.ackmediator.common.api.MessageSubscriber;
import com.ackmediator.common.command.Subscribe;
import com.ackmediator.common.exception.ExceptionLogger;
import com.ackmediator.common.model.PubSubSignal;
import com.ackmediator.common.model.SubscriptionKey;
import com.ackmediator.mediator.config.MediatorConfig;
import io.micronaut.context.ApplicationContext;
import io.micronaut.context.BeanRegistration;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import io.micronaut.inject.BeanDefinition;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scans for @KafkaSubscriber annotated subscribers and subscribes them through the mediator
 */
@Singleton
public class SubscriberAnnotationProcessor implements ApplicationEventListener<StartupEvent> {
    private static final Logger log = LoggerFactory.getLogger(SubscriberAnnotationProcessor.class);

    private final ApplicationContext context;
    private final PubSubMediator mediator;
    private final MediatorConfig config;
    private final Map<SubscriptionKey, Subscribe> subscriptions = new ConcurrentHashMap<>();

    @Inject
    public SubscriberAnnotationProcessor(ApplicationContext context, PubSubMediator mediator, MediatorConfig config) {
        this.context = context;
        this.mediator = mediator;
        this.config = config;
        log.info("SubscriberAnnotationProcessor initialized");
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        log.info("Scanning for @KafkaSubscriber annotated beans...");
        Collection<BeanRegistration<MessageSubscriber>> registrations =
                context.getBeanRegistrations(MessageSubscriber.class);
        log.info("Found {} MessageSubscriber beans", registrations.size());

        for (BeanRegistration<MessageSubscriber> registration : registrations) {
            // Read from bean metadata, the runtime class may be a generated proxy
            BeanDefinition<MessageSubscriber> definition = registration.getBeanDefinition();
            if (definition.hasAnnotation(KafkaSubscriber.class)) {
                register(registration.getBean(), definition.synthesize(KafkaSubscriber.class));
            }
        }

        log.info("Subscriber registration complete. Total subscriptions: {}", subscriptions.size());
    }

    private void register(MessageSubscriber subscriber, KafkaSubscriber annotation) {
        Subscribe request;
        try {
            request = toSubscribe(subscriber, annotation);
        } catch (IllegalArgumentException e) {
            log.error("Invalid @KafkaSubscriber on {}: {}", subscriber.getClass().getName(), e.getMessage());
            return;
        }

        subscriptions.put(request.getKey(), request);
        mediator.subscribe(request).whenComplete((ack, error) -> {
            if (error != null) {
                ExceptionLogger.logFailure(log, "Subscription failed for " + request.getKey(), error);
            } else {
                log.info("Subscribed {} -> group={}, topics={}, retryAttempts={}",
                        subscriber.getClass().getSimpleName(), request.getGroup(), request.getTopics(),
                        request.getRetryAttempts());
            }
        });
    }

    Subscribe toSubscribe(MessageSubscriber subscriber, KafkaSubscriber annotation) {
        String group = resolve(annotation.group());

        Set<String> topics = new LinkedHashSet<>();
        for (String entry : annotation.topics()) {
            for (String topic : resolve(entry).split(",")) {
                if (!topic.isBlank()) {
                    topics.add(topic.trim());
                }
            }
        }

        Duration acknowledgeTimeout = annotation.acknowledgeTimeoutMs() > 0
                ? Duration.ofMillis(annotation.acknowledgeTimeoutMs())
                : config.getAcknowledgeTimeout();
        int retryAttempts = annotation.retryAttempts() > 0
                ? annotation.retryAttempts()
                : config.getRetryAttempts();

        return new Subscribe(group, topics, subscriber, PubSubSignal.ACK, acknowledgeTimeout, PubSubSignal.RETRY,
                retryAttempts, Duration.ofMillis(annotation.minBackoffMs()), Duration.ofMillis(annotation.maxBackoffMs()));
    }

    /**
     * Resolve a {@code ${property:default}} placeholder; other values are returned unchanged
     */
    String resolve(String value) {
        if (value == null || !value.startsWith("${") || !value.endsWith("}")) {
            return value;
        }
        String expression = value.substring(2, value.length() - 1);
        int separator = expression.indexOf(':');
        String name = separator >= 0 ? expression.substring(0, separator) : expression;
        String defaultValue = separator >= 0 ? expression.substring(separator + 1) : null;

        return context.getProperty(name, String.class)
                .orElseGet(() -> {
                    if (defaultValue == null) {
                        throw new IllegalArgumentException("Unresolved property " + name);
                    }
                    return defaultValue;
                });
    }

    public Collection<Subscribe> getAllSubscriptions() {
        return subscriptions.values();
    }
}
