package eu.virtualparadox.labelrecall.rag.index;

import eu.virtualparadox.labelrecall.rag.index.model.CorpusEntry;
import eu.virtualparadox.labelrecall.rag.index.model.SearchHit;
import eu.virtualparadox.labelrecall.rag.index.model.SearchResponse;

import java.time.Duration;
import java.util.List;

/**
 * A built, read-only approximate nearest neighbor (ANN) index over corpus entries.
 * <p>
 * Notes:
 * <ul>
 *   <li>An index is immutable once built; concurrent searches need no locking.</li>
 *   <li>To change the corpus, build a new index and activate it in
 *       {@link ActiveIndexRegistry}; never mutate a live one.</li>
 *   <li>All query vectors must have {@link #dimension()} components, otherwise
 *       {@link DimensionMismatchException} is thrown.</li>
 *   <li>Searching an empty index returns an empty result.</li>
 * </ul>
 */
public interface VectorIndex extends AutoCloseable {

    /**
     * Returns up to {@code k} entries closest to {@code query}, by ascending distance.
     *
     * @param query    query vector
     * @param k        maximum number of hits
     * @param efSearch candidate list width; larger values trade latency for recall
     * @return hits, never {@code null}
     */
    List<SearchHit> search(final float[] query, final int k, final int efSearch);

    /**
     * Like {@link #search(float[], int, int)} but stops walking the graph once
     * {@code timeout} has elapsed, returning whatever was found so far.
     *
     * @param timeout maximum walk time; {@code null} or non-positive means unbounded
     */
    SearchResponse search(final float[] query, final int k, final int efSearch, final Duration timeout);

    CorpusEntry entry(final int entryId);

    int size();

    /**
     * @return vector dimension, or {@code 0} for an empty index
     */
    int dimension();

    DistanceMetric metric();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Releases resources held by the index. Does not throw.
     */
    @Override
    default void close() {
        // nothing to release by default
    }
}
