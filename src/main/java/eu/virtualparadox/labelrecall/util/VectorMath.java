package eu.virtualparadox.labelrecall.util;

/**
 * Dense vector helpers shared by the encoders and the trainer.
 */
public final class VectorMath {

    private static final double EPSILON = 1e-12;

    private VectorMath() {
        // prevent instantiation
    }

    public static double dot(final float[] a, final float[] b) {
        requireSameLength(a, b);
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    public static double norm(final float[] v) {
        double sum = 0.0;
        for (final float x : v) {
            sum += (double) x * x;
        }
        return Math.sqrt(sum);
    }

    /**
     * Returns a unit-length copy of {@code v}. A zero vector is returned as a zero copy.
     */
    public static float[] normalize(final float[] v) {
        final double norm = norm(v);
        final float[] out = new float[v.length];
        if (norm < EPSILON) {
            return out;
        }
        for (int i = 0; i < v.length; i++) {
            out[i] = (float) (v[i] / norm);
        }
        return out;
    }

    /**
     * Back-propagates a gradient through L2 normalization.
     * <p>
     * For {@code y = x / |x|}: {@code dL/dx = (g - y (y . g)) / |x|}.
     *
     * @param raw      the input {@code x} that was normalized
     * @param unit     the normalized output {@code y}
     * @param gradient {@code dL/dy}
     * @return {@code dL/dx}, zero when {@code x} was a zero vector
     */
    public static float[] normalizeBackward(final float[] raw, final float[] unit, final float[] gradient) {
        final double norm = norm(raw);
        final float[] out = new float[raw.length];
        if (norm < EPSILON) {
            return out;
        }
        final double projection = dot(unit, gradient);
        for (int i = 0; i < raw.length; i++) {
            out[i] = (float) ((gradient[i] - unit[i] * projection) / norm);
        }
        return out;
    }

    public static boolean isFinite(final float[] v) {
        for (final float x : v) {
            if (!Float.isFinite(x)) {
                return false;
            }
        }
        return true;
    }

    private static void requireSameLength(final float[] a, final float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimensions must match: " + a.length + " != " + b.length);
        }
    }
}
