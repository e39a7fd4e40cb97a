package eu.virtualparadox.labelrecall.rag.index.hnsw;

import java.time.Duration;

/**
 * Monotonic deadline for a single graph walk.
 */
final class Deadline {

    private static final Deadline NONE = new Deadline(false, 0L);

    private final boolean bounded;
    private final long deadlineNanos;

    private Deadline(final boolean bounded, final long deadlineNanos) {
        this.bounded = bounded;
        this.deadlineNanos = deadlineNanos;
    }

    static Deadline none() {
        return NONE;
    }

    /**
     * @param timeout {@code null}, zero or negative means no deadline
     */
    static Deadline after(final Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return NONE;
        }
        return new Deadline(true, System.nanoTime() + timeout.toNanos());
    }

    boolean expired() {
        return bounded && System.nanoTime() - deadlineNanos >= 0;
    }
}
