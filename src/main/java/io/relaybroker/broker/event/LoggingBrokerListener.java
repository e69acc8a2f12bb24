package io.relaybroker.broker.event;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes every event to the log as {@code [EVENT] name -> payload}.
 * Backpressure and dead-letter events are logged at WARN, everything else at INFO.
 */
@Slf4j
public final class LoggingBrokerListener implements BrokerListener {

    @Override
    public void onEvent(final BrokerEvent event) {
        switch (event.type()) {
            case BACKPRESSURE, DEAD_LETTER -> log.warn("[EVENT] {} -> {}", event.name(), event.payload());
            default -> log.info("[EVENT] {} -> {}", event.name(), event.payload());
        }
    }
}
