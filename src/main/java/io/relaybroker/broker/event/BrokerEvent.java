package io.relaybroker.broker.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An event name plus its payload. The payload keeps insertion order and cannot be modified.
 */
public record BrokerEvent(BrokerEventType type, Map<String, Object> payload) {

    public BrokerEvent {
        Objects.requireNonNull(type, "type");
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * @param keyValues alternating keys (String) and values
     */
    public static BrokerEvent of(final BrokerEventType type, final Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must come in pairs");
        }
        final Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new BrokerEvent(type, map);
    }

    public String name() {
        return type.getWireName();
    }

    public Object get(final String key) {
        return payload.get(key);
    }

    @Override
    public String toString() {
        return name() + " -> " + payload;
    }
}
