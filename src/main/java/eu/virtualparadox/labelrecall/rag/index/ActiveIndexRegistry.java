package eu.virtualparadox.labelrecall.rag.index;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the process-wide "current" index.
 * <p>
 * Lifecycle: {@link #activate(VectorIndex)} publishes an index; activating another one
 * swaps the reference atomically, so a reader sees either the old or the new index,
 * never a partial one. Readers {@link #acquire()} a lease and release it when done,
 * in the manner of Lucene's {@code SearcherManager}; a replaced index is closed once
 * its last lease is released. {@link #teardown()} retires the current index.
 */
@Slf4j
@Service
public class ActiveIndexRegistry {

    private final AtomicReference<Handle> current = new AtomicReference<>();

    /**
     * Publishes {@code index} as the active index, retiring the previous one.
     */
    public void activate(final VectorIndex index) {
        final Handle previous = current.getAndSet(new Handle(index));
        log.info("Activated index with {} entries (dim={})", index.size(), index.dimension());
        if (previous != null) {
            previous.decRef();
        }
    }

    /**
     * Takes a read lease on the active index. Always release it, preferably with
     * try-with-resources.
     *
     * @return a lease; {@link IndexLease#isPresent()} is false when nothing is active
     */
    public IndexLease acquire() {
        while (true) {
            final Handle handle = current.get();
            if (handle == null) {
                return IndexLease.EMPTY;
            }
            if (handle.tryIncRef()) {
                return new IndexLease(handle.index, handle::decRef);
            }
            // lost a race with a swap: the handle was retired, read the new one
        }
    }

    public boolean hasActiveIndex() {
        return current.get() != null;
    }

    /**
     * Retires the active index; it is closed when outstanding leases are released.
     */
    @PreDestroy
    public void teardown() {
        final Handle previous = current.getAndSet(null);
        if (previous != null) {
            previous.decRef();
            log.info("Active index torn down");
        }
    }

    /**
     * Reference-counted index. The registry itself owns one reference.
     */
    private static final class Handle {

        private final VectorIndex index;
        private final AtomicInteger refCount = new AtomicInteger(1);

        Handle(final VectorIndex index) {
            this.index = index;
        }

        boolean tryIncRef() {
            int count;
            while ((count = refCount.get()) > 0) {
                if (refCount.compareAndSet(count, count + 1)) {
                    return true;
                }
            }
            return false;
        }

        void decRef() {
            if (refCount.decrementAndGet() == 0) {
                index.close();
            }
        }
    }
}
