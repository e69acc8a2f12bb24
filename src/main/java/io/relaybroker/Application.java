package io.relaybroker;

import io.relaybroker.broker.Broker;
import io.relaybroker.broker.Publisher;
import io.relaybroker.broker.delivery.BatchedDeliveryStrategy;
import io.relaybroker.broker.delivery.ImmediateDeliveryStrategy;
import io.relaybroker.broker.event.LoggingBrokerListener;
import io.relaybroker.broker.metrics.TopicSummary;
import io.relaybroker.config.BrokerConfig;
import io.relaybroker.config.ConfigLoader;
import io.relaybroker.subscriber.DeliveryOutcome;
import io.relaybroker.subscriber.Subscriber;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Runs the demo scenarios against one broker built from a YAML file (first argument) or the
 * bundled broker.yaml.
 */
@Slf4j
public class Application {
    public static void main(final String[] args) throws Exception {
        final BrokerConfig cfg = ConfigLoader.loadOrDefault(args.length > 0 ? args[0] : null);
        log.info("Starting RelayBroker demo with {}", cfg);

        final Broker broker = cfg.newBroker();
        broker.registerListener(new LoggingBrokerListener());
        final Publisher publisher = new Publisher(broker);

        basicPublish(broker, publisher);
        failureAndRetry(broker, publisher);
        broadcast(broker, publisher);
        strategySwapAndBatch(broker, publisher);
        deadLetterAndSummary(broker, publisher);
    }

    static void basicPublish(final Broker broker, final Publisher publisher) {
        header("Basic publish");
        broker.addSubscriber("news", Subscriber.of("sub_A",
                m -> log.info("sub_A received {}: {}", m.getId(), m.getPayload())));
        publisher.publish("news", Map.of("headline", "Hello World"));
    }

    static void failureAndRetry(final Broker broker, final Publisher publisher) {
        header("Failure + retry");
        broker.addSubscriber("tasks", new Subscriber("flaky", m -> {
            if (m.getAttempts() < 2) {
                return DeliveryOutcome.failure("Transient failure");
            }
            log.info("flaky received after {} attempts: {}", m.getAttempts(), m.getPayload());
            return DeliveryOutcome.success();
        }));
        publisher.publish("tasks", Map.of("job", "process"));
        broker.drain("tasks");
    }

    static void broadcast(final Broker broker, final Publisher publisher) {
        header("Broadcast to multiple subscribers");
        broker.addSubscriber("news", Subscriber.of("sub_B", m -> log.info("sub_B got {}", m.getPayload())));
        publisher.publish("news", Map.of("headline", "Multi-subscriber"));
    }

    static void strategySwapAndBatch(final Broker broker, final Publisher publisher) {
        header("Strategy swap -> batched delivery");
        broker.swapStrategy(new BatchedDeliveryStrategy(2));
        final Publisher metrics = Publisher.forTopic(broker, "metrics");
        metrics.publish(Map.of("value", 1));
        metrics.publish(Map.of("value", 2));
        metrics.publish(Map.of("value", 3));
        broker.flush("metrics");
    }

    static void deadLetterAndSummary(final Broker broker, final Publisher publisher) {
        header("Dead letter + summary");
        broker.swapStrategy(new ImmediateDeliveryStrategy());
        broker.addSubscriber("errors", Subscriber.of("sink", m -> {
            throw new IllegalStateException("Permanent failure");
        }));
        for (int i = 0; i < 5; i++) {
            publisher.publish("errors", Map.of("event", i));
            broker.drain("errors");
        }

        log.info("Dead-letter count: {}", broker.deadLetters().size());
        for (final TopicSummary s : broker.summarize().values()) {
            log.info("{}", s);
        }
    }

    private static void header(final String title) {
        log.info("=== {} ===", title);
    }
}
