package com.ackmediator.common.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Identity of a consumption pipeline: consumer group plus topic set.
 * Topics are kept sorted so the same set always yields the same key and name.
 */
public final class SubscriptionKey {
    private final String group;
    private final Set<String> topics;

    public SubscriptionKey(String group, Set<String> topics) {
        this.group = Objects.requireNonNull(group, "group");
        this.topics = Collections.unmodifiableSet(new TreeSet<>(Objects.requireNonNull(topics, "topics")));
    }

    public String getGroup() {
        return group;
    }

    public Set<String> getTopics() {
        return topics;
    }

    /**
     * Readable name used for thread names and logs, e.g. {@code kafka-consumer-g1-orders_payments}
     */
    public String name() {
        return "kafka-consumer-" + group + "-" + String.join("_", topics);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubscriptionKey that = (SubscriptionKey) o;
        return group.equals(that.group) && topics.equals(that.topics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(group, topics);
    }

    @Override
    public String toString() {
        return "SubscriptionKey{group=" + group + ", topics=" + topics + "}";
    }
}
