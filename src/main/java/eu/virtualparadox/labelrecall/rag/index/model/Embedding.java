package eu.virtualparadox.labelrecall.rag.index.model;

import java.util.Objects;

/**
 * A dense vector owned by a corpus entry or a query.
 *
 * @param ownerId identifier of the owner
 * @param vector  the vector; copied on construction and on every read
 */
public record Embedding(String ownerId, float[] vector) {

    public Embedding {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(vector, "vector must not be null");
        if (vector.length == 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        vector = vector.clone();
    }

    /**
     * @return a copy of the vector; writes to it never reach indexes built from this embedding
     */
    @Override
    public float[] vector() {
        return vector.clone();
    }

    public int dim() {
        return vector.length;
    }
}
