package eu.virtualparadox.labelrecall.train.model;

import eu.virtualparadox.labelrecall.train.SimilarityMode;

import java.util.Objects;

/**
 * Hyper-parameters of a contrastive training run.
 *
 * @param epochs                         passes over the training pairs
 * @param batchSize                      pairs per step; each pair's positive is a negative for the others
 * @param learningRate                   SGD step size
 * @param margin                         subtracted from the positive similarity before scaling
 * @param scale                          logit multiplier in {@link SimilarityMode#COSINE} mode
 * @param similarity                     how embeddings are compared
 * @param symmetric                      also score positives against queries and average both losses
 * @param seed                           shuffling seed
 * @param workers                        data-parallel shards per step, {@code 1} for a plain step
 * @param maxConsecutiveNumericFailures  numeric failures in a row after which the run is degraded
 */
public record TrainingConfig(int epochs,
                             int batchSize,
                             float learningRate,
                             float margin,
                             float scale,
                             SimilarityMode similarity,
                             boolean symmetric,
                             long seed,
                             int workers,
                             int maxConsecutiveNumericFailures) {

    public static final float DEFAULT_MARGIN = 0.2f;
    public static final float DEFAULT_SCALE = 20f;

    public TrainingConfig {
        Objects.requireNonNull(similarity, "similarity must not be null");
        if (epochs < 0) {
            throw new IllegalArgumentException("epochs must be >= 0");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        if (!(learningRate > 0f) || !Float.isFinite(learningRate)) {
            throw new IllegalArgumentException("learningRate must be a positive number, got " + learningRate);
        }
        if (!(scale > 0f)) {
            throw new IllegalArgumentException("scale must be > 0, got " + scale);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1");
        }
        if (maxConsecutiveNumericFailures < 1) {
            throw new IllegalArgumentException("maxConsecutiveNumericFailures must be >= 1");
        }
    }

    public static TrainingConfig defaults() {
        return new TrainingConfig(3, 32, 0.05f, DEFAULT_MARGIN, DEFAULT_SCALE, SimilarityMode.COSINE,
                false, 42L, 1, 5);
    }

    /**
     * @return the logit multiplier actually used: {@link #scale()} for cosine, {@code 1} for dot product
     */
    public float effectiveScale() {
        return similarity == SimilarityMode.COSINE ? scale : 1f;
    }

    public TrainingConfig withLearningRate(final float lr) {
        return new TrainingConfig(epochs, batchSize, lr, margin, scale, similarity, symmetric, seed, workers,
                maxConsecutiveNumericFailures);
    }

    public TrainingConfig withEpochs(final int newEpochs) {
        return new TrainingConfig(newEpochs, batchSize, learningRate, margin, scale, similarity, symmetric, seed,
                workers, maxConsecutiveNumericFailures);
    }

    public TrainingConfig withBatchSize(final int newBatchSize) {
        return new TrainingConfig(epochs, newBatchSize, learningRate, margin, scale, similarity, symmetric, seed,
                workers, maxConsecutiveNumericFailures);
    }

    public TrainingConfig withSymmetric(final boolean newSymmetric) {
        return new TrainingConfig(epochs, batchSize, learningRate, margin, scale, similarity, newSymmetric, seed,
                workers, maxConsecutiveNumericFailures);
    }

    public TrainingConfig withWorkers(final int newWorkers) {
        return new TrainingConfig(epochs, batchSize, learningRate, margin, scale, similarity, symmetric, seed,
                newWorkers, maxConsecutiveNumericFailures);
    }
}
