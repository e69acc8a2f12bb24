package io.relaybroker;

import io.relaybroker.broker.Broker;
import io.relaybroker.broker.Publisher;
import io.relaybroker.broker.metrics.TopicSummary;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ApplicationTest {

    @Test
    void demoRunsWithBundledConfig() {
        assertDoesNotThrow(() -> Application.main(new String[0]));
    }

    @Test
    void demoScenariosLeaveExpectedState() {
        final Broker broker = new Broker();
        final Publisher publisher = new Publisher(broker);

        Application.basicPublish(broker, publisher);
        Application.failureAndRetry(broker, publisher);
        Application.broadcast(broker, publisher);
        Application.strategySwapAndBatch(broker, publisher);
        Application.deadLetterAndSummary(broker, publisher);

        assertEquals(5, broker.deadLetters().size());

        final TopicSummary news = broker.summarize().get("news");
        assertEquals(2, news.published());
        assertEquals(2, news.delivered());
        assertEquals(2, news.subscriberCount());

        final TopicSummary tasks = broker.summarize().get("tasks");
        assertEquals(1, tasks.delivered());
        assertEquals(1, tasks.failed());

        final TopicSummary metrics = broker.summarize().get("metrics");
        assertEquals(3, metrics.published());
        assertEquals(3, metrics.delivered());
        assertEquals(0, metrics.queueLength());

        final TopicSummary errors = broker.summarize().get("errors");
        assertEquals(5, errors.deadLetter());
        assertEquals(15, errors.failed());
    }
}
