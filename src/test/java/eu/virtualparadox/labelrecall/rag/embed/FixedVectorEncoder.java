package eu.virtualparadox.labelrecall.rag.embed;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encoder with a hand-picked vector per known text, for tests that need exact geometry.
 */
public final class FixedVectorEncoder implements TextEncoder {

    private final int dimension;
    private final Map<String, float[]> vectors = new LinkedHashMap<>();

    public FixedVectorEncoder(final int dimension) {
        this.dimension = dimension;
    }

    public FixedVectorEncoder put(final String text, final float... vector) {
        if (vector.length != dimension) {
            throw new IllegalArgumentException("Expected " + dimension + " components, got " + vector.length);
        }
        vectors.put(text, vector.clone());
        return this;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public float[] encode(final String text) {
        final float[] vector = vectors.get(text);
        if (vector == null) {
            throw new IllegalArgumentException("Unknown text: " + text);
        }
        return vector.clone();
    }

    @Override
    public String name() {
        return "fixed";
    }
}
