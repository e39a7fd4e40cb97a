package eu.virtualparadox.labelrecall.rag.index;

import java.util.Objects;

/**
 * Construction parameters of a vector index.
 *
 * @param backend        index implementation
 * @param metric         distance metric
 * @param m              max connections per node on upper layers (layer 0 keeps {@code 2m})
 * @param efConstruction beam width while inserting
 * @param seed           seed of the level generator; with a fixed insertion order it makes builds reproducible
 */
public record IndexConfig(IndexBackend backend, DistanceMetric metric, int m, int efConstruction, long seed) {

    public static final int DEFAULT_M = 16;
    public static final int DEFAULT_EF_CONSTRUCTION = 200;
    public static final long DEFAULT_SEED = 42L;

    public IndexConfig {
        Objects.requireNonNull(backend, "backend must not be null");
        Objects.requireNonNull(metric, "metric must not be null");
        if (m < 2) {
            throw new IllegalArgumentException("m must be >= 2, got " + m);
        }
        if (efConstruction < 1) {
            throw new IllegalArgumentException("efConstruction must be >= 1, got " + efConstruction);
        }
    }

    public static IndexConfig hnsw(final DistanceMetric metric) {
        return new IndexConfig(IndexBackend.HNSW, metric, DEFAULT_M, DEFAULT_EF_CONSTRUCTION, DEFAULT_SEED);
    }

    public IndexConfig withM(final int newM) {
        return new IndexConfig(backend, metric, newM, efConstruction, seed);
    }

    public IndexConfig withEfConstruction(final int newEf) {
        return new IndexConfig(backend, metric, m, newEf, seed);
    }
}
