package io.relaybroker.broker.deadletter;

import io.relaybroker.broker.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only sink for messages whose retries are exhausted. Entries are kept for the
 * lifetime of the store.
 */
public final class DeadLetterStore {
    private final List<DeadLetter> entries = new ArrayList<>();

    public synchronized void add(final DeadLetter entry) {
        entries.add(Objects.requireNonNull(entry, "entry"));
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Snapshot of all entries in dead-letter order.
     */
    public synchronized List<DeadLetter> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public synchronized List<Message> messages() {
        final List<Message> out = new ArrayList<>(entries.size());
        for (final DeadLetter e : entries) {
            out.add(e.message());
        }
        return Collections.unmodifiableList(out);
    }

    public synchronized List<DeadLetter> forTopic(final String topic) {
        final List<DeadLetter> out = new ArrayList<>();
        for (final DeadLetter e : entries) {
            if (e.topic().equals(topic)) out.add(e);
        }
        return Collections.unmodifiableList(out);
    }

    public synchronized boolean contains(final long messageId) {
        for (final DeadLetter e : entries) {
            if (e.messageId() == messageId) return true;
        }
        return false;
    }
}
