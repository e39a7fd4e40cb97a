package eu.virtualparadox.labelrecall.train;

/**
 * How the trainer compares query and positive embeddings.
 */
public enum SimilarityMode {

    /** Embeddings L2-normalized before the dot product, logits multiplied by the configured scale. */
    COSINE,

    /** Raw dot product, scale fixed to 1. */
    DOT
}
