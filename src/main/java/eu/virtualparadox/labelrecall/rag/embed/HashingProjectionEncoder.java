package eu.virtualparadox.labelrecall.rag.embed;

import eu.virtualparadox.labelrecall.util.VectorMath;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Trainable twin encoder: hashed character n-grams projected through a learned matrix.
 * <p>
 * A text is lower-cased, wrapped in boundary markers and split into character n-grams
 * ({@code minGram..maxGram} code points). Each n-gram is hashed into one of
 * {@code buckets} rows of the projection matrix {@code W} (buckets x dimension); the
 * embedding is the frequency-weighted sum of the selected rows, optionally L2-normalized.
 * <p>
 * Works on any script, including CJK, because it never needs a vocabulary. Initial
 * weights come from a seeded {@link Random}, so two encoders built with the same
 * settings produce identical vectors.
 */
@Slf4j
public final class HashingProjectionEncoder implements TrainableEncoder {

    private static final int BOUNDARY_START = 0x2;
    private static final int BOUNDARY_END = 0x3;
    private static final int FNV_OFFSET = 0x811C9DC5;
    private static final int FNV_PRIME = 0x01000193;

    private final int dimension;
    private final int buckets;
    private final int minGram;
    private final int maxGram;
    private final boolean normalize;
    private final float[][] weights;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public HashingProjectionEncoder(final int dimension,
                                    final int buckets,
                                    final int minGram,
                                    final int maxGram,
                                    final boolean normalize,
                                    final long seed) {
        if (dimension <= 0 || buckets <= 0) {
            throw new IllegalArgumentException("dimension and buckets must be > 0");
        }
        if (minGram <= 0 || maxGram < minGram) {
            throw new IllegalArgumentException("Invalid n-gram range: " + minGram + ".." + maxGram);
        }
        this.dimension = dimension;
        this.buckets = buckets;
        this.minGram = minGram;
        this.maxGram = maxGram;
        this.normalize = normalize;
        this.weights = new float[buckets][dimension];

        final Random random = new Random(seed);
        final double std = 1.0 / Math.sqrt(dimension);
        for (final float[] row : weights) {
            for (int j = 0; j < dimension; j++) {
                row[j] = (float) (random.nextGaussian() * std);
            }
        }
        log.info("Initialized hashing encoder: dim={}, buckets={}, n-grams={}..{}, normalize={}",
                dimension, buckets, minGram, maxGram, normalize);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String name() {
        return "hashing-" + minGram + "-" + maxGram + "x" + dimension;
    }

    @Override
    public float[] encode(final String text) {
        return forward(text).output();
    }

    @Override
    public HashedPass forward(final String text) {
        final Features features = extractFeatures(text);
        final float[] raw = new float[dimension];

        lock.readLock().lock();
        try {
            for (int f = 0; f < features.rows.length; f++) {
                final float[] row = weights[features.rows[f]];
                final float value = features.values[f];
                for (int j = 0; j < dimension; j++) {
                    raw[j] += value * row[j];
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        final float[] output = normalize ? VectorMath.normalize(raw) : raw;
        return new HashedPass(features, raw, output);
    }

    @Override
    public void backward(final ForwardPass pass, final float[] outputGradient, final SparseGradient gradient) {
        if (!(pass instanceof HashedPass hashed)) {
            throw new IllegalArgumentException("Forward pass was not produced by this encoder");
        }
        if (outputGradient.length != dimension) {
            throw new IllegalArgumentException("Output gradient must have length " + dimension);
        }

        final float[] rawGradient = normalize
                ? VectorMath.normalizeBackward(hashed.raw(), hashed.output(), outputGradient)
                : outputGradient;

        final Features features = hashed.features();
        for (int f = 0; f < features.rows.length; f++) {
            gradient.add(features.rows[f], features.values[f], rawGradient);
        }
    }

    @Override
    public void apply(final SparseGradient gradient, final float learningRate) {
        if (gradient.width() != dimension) {
            throw new IllegalArgumentException("Gradient width " + gradient.width() + " != dimension " + dimension);
        }
        lock.writeLock().lock();
        try {
            for (final Map.Entry<Integer, float[]> e : gradient.rows().entrySet()) {
                final float[] row = weights[e.getKey()];
                final float[] g = e.getValue();
                for (int j = 0; j < dimension; j++) {
                    row[j] -= learningRate * g[j];
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public SparseGradient newGradient() {
        return new SparseGradient(dimension);
    }

    private Features extractFeatures(final String text) {
        final int[] codePoints = wrap(text.toLowerCase(Locale.ROOT).codePoints().toArray());

        // TreeMap keeps feature order stable, which keeps float summation deterministic
        final Map<Integer, Integer> counts = new TreeMap<>();
        int total = 0;
        for (int n = minGram; n <= maxGram; n++) {
            for (int start = 0; start + n <= codePoints.length; start++) {
                counts.merge(bucketOf(codePoints, start, n), 1, Integer::sum);
                total++;
            }
        }
        if (total == 0) {
            // shorter than minGram even with boundaries: fall back to the whole sequence
            counts.put(bucketOf(codePoints, 0, codePoints.length), 1);
            total = 1;
        }

        final int[] rows = new int[counts.size()];
        final float[] values = new float[counts.size()];
        int i = 0;
        for (final Map.Entry<Integer, Integer> e : counts.entrySet()) {
            rows[i] = e.getKey();
            values[i] = (float) e.getValue() / total;
            i++;
        }
        return new Features(rows, values);
    }

    private int bucketOf(final int[] codePoints, final int start, final int length) {
        int hash = FNV_OFFSET ^ length;
        for (int i = start; i < start + length; i++) {
            hash ^= codePoints[i];
            hash *= FNV_PRIME;
        }
        return Math.floorMod(hash, buckets);
    }

    private static int[] wrap(final int[] codePoints) {
        final int[] wrapped = new int[codePoints.length + 2];
        wrapped[0] = BOUNDARY_START;
        System.arraycopy(codePoints, 0, wrapped, 1, codePoints.length);
        wrapped[wrapped.length - 1] = BOUNDARY_END;
        return wrapped;
    }

    private record Features(int[] rows, float[] values) {
    }

    /**
     * Activations of one forward call: hashed features, pre-normalization sum and output.
     */
    public static final class HashedPass implements ForwardPass {

        private final Features features;
        private final float[] raw;
        private final float[] output;

        private HashedPass(final Features features, final float[] raw, final float[] output) {
            this.features = features;
            this.raw = raw;
            this.output = output;
        }

        @Override
        public float[] output() {
            return output;
        }

        private Features features() {
            return features;
        }

        private float[] raw() {
            return raw;
        }
    }
}
