package eu.virtualparadox.labelrecall.train;

/**
 * Margin-adjusted softmax cross-entropy over an in-batch similarity matrix.
 * <p>
 * For queries {@code Q} and positives {@code P} (both N x d) the similarity matrix is
 * {@code S = Q P^T}. Row {@code i} is a classification problem whose correct answer is
 * column {@code i}; every other positive in the batch acts as a negative:
 * <pre>
 *   L[i][j] = scale * (S[i][j] - margin * [i == j])
 *   loss    = mean_i ( logsumexp_j L[i][j] - L[i][i] )
 * </pre>
 * The symmetric variant also solves the column problems (each positive picks its
 * query among all queries) and averages both losses.
 * <p>
 * Everything is accumulated in double precision; the class holds no state.
 */
public final class InBatchNegativeLoss {

    private final float margin;
    private final float scale;
    private final boolean symmetric;

    public InBatchNegativeLoss(final float margin, final float scale, final boolean symmetric) {
        this.margin = margin;
        this.scale = scale;
        this.symmetric = symmetric;
    }

    /**
     * Loss value only.
     */
    public double loss(final float[][] queries, final float[][] positives) {
        return compute(queries, positives, false).loss();
    }

    /**
     * Loss and its gradients with respect to every query and positive vector.
     *
     * @throws IllegalArgumentException if the two sides differ in count or width
     */
    public Result lossAndGradients(final float[][] queries, final float[][] positives) {
        return compute(queries, positives, true);
    }

    private Result compute(final float[][] queries, final float[][] positives, final boolean withGradients) {
        final int n = queries.length;
        if (n != positives.length) {
            throw new IllegalArgumentException("Query count " + n + " != positive count " + positives.length);
        }
        if (n == 0) {
            throw new IllegalArgumentException("Batch must not be empty");
        }
        final int dim = queries[0].length;

        final double[][] logits = new double[n][n];
        for (int i = 0; i < n; i++) {
            checkWidth(queries[i], dim);
            for (int j = 0; j < n; j++) {
                checkWidth(positives[j], dim);
                double s = 0.0;
                for (int k = 0; k < dim; k++) {
                    s += (double) queries[i][k] * positives[j][k];
                }
                logits[i][j] = scale * (i == j ? s - margin : s);
            }
        }

        // dLogits[i][j] = dLoss / dL[i][j]
        final double[][] dLogits = new double[n][n];
        final double rowWeight = symmetric ? 0.5 / n : 1.0 / n;

        double loss = 0.0;
        final double[] probabilities = new double[n];
        for (int i = 0; i < n; i++) {
            final int row = i;
            loss += rowWeight * crossEntropy(j -> logits[row][j], n, i, probabilities);
            for (int j = 0; j < n; j++) {
                dLogits[i][j] += rowWeight * (probabilities[j] - (i == j ? 1.0 : 0.0));
            }
        }
        if (symmetric) {
            for (int j = 0; j < n; j++) {
                final int col = j;
                loss += rowWeight * crossEntropy(i -> logits[i][col], n, j, probabilities);
                for (int i = 0; i < n; i++) {
                    dLogits[i][j] += rowWeight * (probabilities[i] - (i == j ? 1.0 : 0.0));
                }
            }
        }

        if (!withGradients) {
            return new Result(loss, null, null);
        }

        final float[][] dQueries = new float[n][dim];
        final float[][] dPositives = new float[n][dim];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                // dS = scale * dLogits; the margin is a constant shift
                final double g = scale * dLogits[i][j];
                if (g == 0.0) {
                    continue;
                }
                for (int k = 0; k < dim; k++) {
                    dQueries[i][k] += (float) (g * positives[j][k]);
                    dPositives[j][k] += (float) (g * queries[i][k]);
                }
            }
        }
        return new Result(loss, dQueries, dPositives);
    }

    /**
     * Cross-entropy of one logit vector against {@code target}; fills {@code probabilities} with the softmax.
     */
    private static double crossEntropy(final Logits logits, final int n, final int target, final double[] probabilities) {
        double max = Double.NEGATIVE_INFINITY;
        for (int j = 0; j < n; j++) {
            max = Math.max(max, logits.at(j));
        }
        double sum = 0.0;
        for (int j = 0; j < n; j++) {
            probabilities[j] = Math.exp(logits.at(j) - max);
            sum += probabilities[j];
        }
        for (int j = 0; j < n; j++) {
            probabilities[j] /= sum;
        }
        return max + Math.log(sum) - logits.at(target);
    }

    private static void checkWidth(final float[] v, final int dim) {
        if (v.length != dim) {
            throw new IllegalArgumentException("All embeddings must have dimension " + dim + ", got " + v.length);
        }
    }

    @FunctionalInterface
    private interface Logits {
        double at(int index);
    }

    /**
     * @param loss       mean batch loss
     * @param dQueries   {@code dLoss/dQ}, {@code null} when gradients were not requested
     * @param dPositives {@code dLoss/dP}, {@code null} when gradients were not requested
     */
    public record Result(double loss, float[][] dQueries, float[][] dPositives) {
    }
}
