package eu.virtualparadox.labelrecall.rag.index;

import eu.virtualparadox.labelrecall.rag.index.model.CorpusEntry;

import java.util.List;

/**
 * Builds a {@link VectorIndex} from embedded corpus entries.
 */
public interface VectorIndexBuilder {

    /**
     * Builds a new index.
     *
     * @param entries entries with consecutive ids {@code 0..n-1} matching their list position;
     *                all vectors must share one dimension. An empty list builds an empty index.
     * @param config  construction parameters
     * @return the built index
     * @throws DimensionMismatchException if vector dimensions differ
     * @throws IllegalArgumentException   if entry ids do not match list positions
     */
    VectorIndex build(final List<CorpusEntry> entries, final IndexConfig config);

    IndexBackend backend();
}
