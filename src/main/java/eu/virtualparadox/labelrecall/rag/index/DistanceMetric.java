package eu.virtualparadox.labelrecall.rag.index;

import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.util.VectorUtil;

/**
 * Distance functions supported by the indexes. Every metric orders candidates by
 * ascending distance and maps a distance to a similarity score (higher = better).
 */
public enum DistanceMetric {

    /** {@code 1 - cos(a, b)}; score is the cosine similarity. */
    COSINE(VectorSimilarityFunction.COSINE) {
        @Override
        public float distance(final float[] a, final float[] b) {
            // zero vectors have no direction: treat as orthogonal
            if (isZero(a) || isZero(b)) {
                return 1.0f;
            }
            return 1.0f - VectorUtil.cosine(a, b);
        }

        @Override
        public float toScore(final float distance) {
            return 1.0f - distance;
        }
    },

    /** Squared euclidean distance; score is {@code 1 / (1 + d)}. */
    L2(VectorSimilarityFunction.EUCLIDEAN) {
        @Override
        public float distance(final float[] a, final float[] b) {
            return VectorUtil.squareDistance(a, b);
        }

        @Override
        public float toScore(final float distance) {
            return 1.0f / (1.0f + distance);
        }
    },

    /** Negated inner product; score is the inner product. */
    DOT(VectorSimilarityFunction.MAXIMUM_INNER_PRODUCT) {
        @Override
        public float distance(final float[] a, final float[] b) {
            return -VectorUtil.dotProduct(a, b);
        }

        @Override
        public float toScore(final float distance) {
            return -distance;
        }
    };

    private final VectorSimilarityFunction luceneFunction;

    DistanceMetric(final VectorSimilarityFunction luceneFunction) {
        this.luceneFunction = luceneFunction;
    }

    public abstract float distance(final float[] a, final float[] b);

    public abstract float toScore(final float distance);

    /**
     * @return {@code false} for a vector this metric cannot compare meaningfully (a zero vector under cosine)
     */
    public boolean supports(final float[] v) {
        return this != COSINE || !isZero(v);
    }

    private static boolean isZero(final float[] v) {
        return VectorUtil.dotProduct(v, v) == 0.0f;
    }

    /**
     * @return the equivalent Lucene similarity, used by the Lucene backend
     */
    public VectorSimilarityFunction luceneFunction() {
        return luceneFunction;
    }
}
