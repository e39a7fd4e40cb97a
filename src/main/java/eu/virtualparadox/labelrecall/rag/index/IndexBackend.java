package eu.virtualparadox.labelrecall.rag.index;

/**
 * Index implementations available to {@link ReindexService}.
 */
public enum IndexBackend {
    /** In-process hierarchical navigable small-world graph. */
    HNSW,
    /** In-memory Lucene index with a {@code KnnFloatVectorField}. */
    LUCENE
}
