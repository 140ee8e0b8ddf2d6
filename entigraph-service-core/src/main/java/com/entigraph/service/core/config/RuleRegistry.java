package com.entigraph.service.core.config;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Component;

/**
 * Global, lock-free in-memory holder of the active rule snapshot.
 * Readers are wait-free via a single AtomicReference; writers are serialized so that a reload and
 * an admin update cannot interleave and drop each other's rule sets.
 */
@Component
public class RuleRegistry {
    private final AtomicReference<RuleSnapshot> ref = new AtomicReference<>(RuleSnapshot.empty());
    private final Object writeLock = new Object();

    /** Returns the current immutable snapshot. */
    public RuleSnapshot current() {
        return ref.get();
    }

    /** Atomically replaces the current snapshot. */
    public void swap(RuleSnapshot next) {
        synchronized (writeLock) {
            ref.set(next);
        }
    }

    /**
     * Derives the next snapshot from the current one and installs it. If {@code next} throws, the
     * current snapshot stays in place.
     */
    public RuleSnapshot update(UnaryOperator<RuleSnapshot> next) {
        synchronized (writeLock) {
            RuleSnapshot updated = next.apply(ref.get());
            ref.set(updated);
            return updated;
        }
    }
}
