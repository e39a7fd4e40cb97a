package eu.virtualparadox.labelrecall.rag.index;

import java.util.NoSuchElementException;

/**
 * A read lease on the active index obtained from {@link ActiveIndexRegistry#acquire()}.
 */
public final class IndexLease implements AutoCloseable {

    static final IndexLease EMPTY = new IndexLease(null, () -> {
    });

    private final VectorIndex index;
    private final Runnable release;
    private boolean released;

    IndexLease(final VectorIndex index, final Runnable release) {
        this.index = index;
        this.release = release;
    }

    public boolean isPresent() {
        return index != null;
    }

    /**
     * @throws NoSuchElementException if no index was active
     */
    public VectorIndex index() {
        if (index == null) {
            throw new NoSuchElementException("No active index");
        }
        return index;
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            release.run();
        }
    }
}
