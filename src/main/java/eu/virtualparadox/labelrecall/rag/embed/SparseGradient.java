package eu.virtualparadox.labelrecall.rag.embed;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Row-sparse gradient of a weight matrix: only rows touched by the batch are stored.
 * <p>Not thread-safe; each worker accumulates its own instance and the results are merged.</p>
 */
public final class SparseGradient {

    private final int width;
    private final Map<Integer, float[]> rows = new HashMap<>();

    public SparseGradient(final int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Gradient width must be > 0");
        }
        this.width = width;
    }

    /**
     * Adds {@code factor * values} to row {@code row}.
     */
    public void add(final int row, final float factor, final float[] values) {
        if (values.length != width) {
            throw new IllegalArgumentException("Gradient row must have length " + width);
        }
        final float[] target = rows.computeIfAbsent(row, r -> new float[width]);
        for (int i = 0; i < width; i++) {
            target[i] += factor * values[i];
        }
    }

    /**
     * Adds every row of {@code other} into this gradient (the all-reduce sum).
     */
    public void merge(final SparseGradient other) {
        if (other.width != width) {
            throw new IllegalArgumentException("Cannot merge gradients of width " + other.width + " into " + width);
        }
        for (final Map.Entry<Integer, float[]> e : other.rows.entrySet()) {
            add(e.getKey(), 1.0f, e.getValue());
        }
    }

    public void scale(final float factor) {
        for (final float[] row : rows.values()) {
            for (int i = 0; i < row.length; i++) {
                row[i] *= factor;
            }
        }
    }

    public boolean isFinite() {
        for (final float[] row : rows.values()) {
            for (final float v : row) {
                if (!Float.isFinite(v)) {
                    return false;
                }
            }
        }
        return true;
    }

    public Map<Integer, float[]> rows() {
        return Collections.unmodifiableMap(rows);
    }

    public int width() {
        return width;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
