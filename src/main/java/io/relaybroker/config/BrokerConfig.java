package io.relaybroker.config;

import io.relaybroker.broker.Broker;
import io.relaybroker.broker.delivery.BatchedDeliveryStrategy;
import io.relaybroker.broker.delivery.DeliveryStrategy;
import io.relaybroker.broker.delivery.ImmediateDeliveryStrategy;
import io.relaybroker.broker.retry.RetryPolicy;
import io.relaybroker.broker.retry.SimpleRetryPolicy;
import io.relaybroker.registry.TopicRegistry;
import lombok.Getter;
import lombok.ToString;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable config holder loaded from broker.yaml. Missing keys keep their defaults.
 * <pre>
 * maxQueueSize: 10
 * retry:
 *   maxAttempts: 3
 *   backoffFactor: 0.25
 * delivery:
 *   strategy: immediate    # or batched
 *   batchSize: 3
 * topics: [news, tasks]    # optional, declared up front
 * </pre>
 */
@Getter
@ToString
public final class BrokerConfig {

    public enum DeliveryMode {
        IMMEDIATE,
        BATCHED
    }

    private int maxQueueSize = Broker.DEFAULT_MAX_QUEUE_SIZE;
    private int maxAttempts = SimpleRetryPolicy.DEFAULT_MAX_ATTEMPTS;
    private double backoffFactor = SimpleRetryPolicy.DEFAULT_BACKOFF_FACTOR;
    private DeliveryMode deliveryMode = DeliveryMode.IMMEDIATE;
    private int batchSize = BatchedDeliveryStrategy.DEFAULT_BATCH_SIZE;
    private List<String> topics = List.of();

    private BrokerConfig() {
    }

    public static BrokerConfig defaults() {
        return new BrokerConfig();
    }

    public static BrokerConfig load(final String path) throws IOException {
        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            return load(in);
        }
    }

    public static BrokerConfig load(final InputStream in) {
        final Object root = new Yaml().load(in);
        if (root != null && !(root instanceof Map)) {
            throw new IllegalArgumentException("config root must be a mapping, got: " + root);
        }
        return fromMap(section(root, "config"));
    }

    public static BrokerConfig fromMap(final Map<String, Object> m) {
        final BrokerConfig cfg = new BrokerConfig();
        if (m == null) return cfg;

        cfg.maxQueueSize = intValue(m, "maxQueueSize", cfg.maxQueueSize);

        final Map<String, Object> retry = section(m.get("retry"), "retry");
        if (retry != null) {
            cfg.maxAttempts   = intValue(retry, "maxAttempts", cfg.maxAttempts);
            cfg.backoffFactor = doubleValue(retry, "backoffFactor", cfg.backoffFactor);
        }

        final Map<String, Object> delivery = section(m.get("delivery"), "delivery");
        if (delivery != null) {
            if (delivery.containsKey("strategy")) {
                final Object mode = delivery.get("strategy");
                if (!(mode instanceof String s)) {
                    throw new IllegalArgumentException("delivery.strategy must be a string, got: " + mode);
                }
                try {
                    cfg.deliveryMode = DeliveryMode.valueOf(s.trim().toUpperCase(Locale.ROOT));
                } catch (final IllegalArgumentException e) {
                    throw new IllegalArgumentException("unknown delivery strategy: " + s, e);
                }
            }
            cfg.batchSize = intValue(delivery, "batchSize", cfg.batchSize);
        }

        final Object topics = m.get("topics");
        if (topics != null) {
            if (!(topics instanceof List<?> list) || !list.stream().allMatch(String.class::isInstance)) {
                throw new IllegalArgumentException("topics must be a list of names, got: " + topics);
            }
            cfg.topics = list.stream().map(String.class::cast).toList();
        }

        cfg.validate();
        return cfg;
    }

    public RetryPolicy newRetryPolicy() {
        return new SimpleRetryPolicy(maxAttempts, backoffFactor);
    }

    public DeliveryStrategy newDeliveryStrategy() {
        return switch (deliveryMode) {
            case IMMEDIATE -> new ImmediateDeliveryStrategy();
            case BATCHED -> new BatchedDeliveryStrategy(batchSize);
        };
    }

    public Broker.Builder toBuilder() {
        return Broker.builder()
                .maxQueueSize(maxQueueSize)
                .retryPolicy(newRetryPolicy())
                .deliveryStrategy(newDeliveryStrategy())
                .registry(TopicRegistry.builder().topics(topics).build());
    }

    public Broker newBroker() {
        return toBuilder().build();
    }

    private void validate() {
        if (maxQueueSize <= 0) throw new IllegalArgumentException("maxQueueSize must be > 0");
        if (maxAttempts <= 0) throw new IllegalArgumentException("retry.maxAttempts must be > 0");
        if (backoffFactor < 0) throw new IllegalArgumentException("retry.backoffFactor must be >= 0");
        if (batchSize <= 0) throw new IllegalArgumentException("delivery.batchSize must be > 0");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(final Object v, final String key) {
        if (v == null) return null;
        if (v instanceof Map) return (Map<String, Object>) v;
        throw new IllegalArgumentException(key + " must be a mapping, got: " + v);
    }

    private static int intValue(final Map<String, Object> m, final String key, final int fallback) {
        final Object v = m.get(key);
        if (v == null) return fallback;
        if (v instanceof Integer i) return i;
        if (v instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) return l.intValue();
        throw new IllegalArgumentException(key + " must be an integer within int range, got: " + v);
    }

    private static double doubleValue(final Map<String, Object> m, final String key, final double fallback) {
        final Object v = m.get(key);
        if (v == null) return fallback;
        if (v instanceof Number n && Double.isFinite(n.doubleValue())) return n.doubleValue();
        throw new IllegalArgumentException(key + " must be a finite number, got: " + v);
    }
}
