package io.relaybroker.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of known topics in creation order. Topics are created implicitly on first use;
 * the builder can declare some up front so they show in summaries before any traffic.
 * <p>
 * Not thread-safe: the broker that owns the registry serializes access to it.
 * </p>
 */
public final class TopicRegistry {
    private final Map<String, TopicState> topics = new LinkedHashMap<>();

    private TopicRegistry(final Set<String> declared) {
        for (final String topic : declared) {
            topics.put(topic, new TopicState(topic));
        }
    }

    public TopicRegistry() {
        this(Set.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(final String topic) {
        return topics.containsKey(topic);
    }

    public TopicState getOrCreate(final String topic) {
        Objects.requireNonNull(topic, "topic");
        return topics.computeIfAbsent(topic, TopicState::new);
    }

    public Optional<TopicState> find(final String topic) {
        return Optional.ofNullable(topics.get(topic));
    }

    public Set<String> listTopics() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(topics.keySet()));
    }

    public List<TopicState> states() {
        return List.copyOf(topics.values());
    }

    public static final class Builder {
        private final Set<String> declared = new LinkedHashSet<>();

        public Builder topic(final String topic) {
            declared.add(Objects.requireNonNull(topic, "topic"));
            return this;
        }

        public Builder topics(final Iterable<String> topics) {
            for (final String t : topics) {
                topic(t);
            }
            return this;
        }

        public TopicRegistry build() {
            return new TopicRegistry(declared);
        }
    }
}
