package io.relaybroker.core.sequence;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;

/**
 * Monotonic id allocator owned by a single broker. Ids start at 1.
 */
public final class MessageIdSequence {
    private static final VarHandle VH;

    static {
        try {
            VH = MethodHandles.lookup().findVarHandle(MessageIdSequence.class, "value", long.class);
        } catch (final ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private volatile long value;

    public MessageIdSequence() {
        this(0L);
    }

    /**
     * @param last the id considered already issued; the next call to {@link #next()} returns {@code last + 1}
     */
    public MessageIdSequence(final long last) {
        if (last < 0) throw new IllegalArgumentException("last must be >= 0");
        VH.setRelease(this, last);
    }

    public long next() {
        return (long) VH.getAndAdd(this, 1L) + 1L;
    }

    /**
     * The most recently issued id, or the initial value if none was issued yet.
     */
    public long current() {
        return value;
    }
}
