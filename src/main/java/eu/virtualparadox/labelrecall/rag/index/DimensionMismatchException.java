package eu.virtualparadox.labelrecall.rag.index;

/**
 * Raised when vectors of different dimensions meet in one index or one comparison.
 * <p>Never recovered: vectors are not truncated or padded.</p>
 */
public class DimensionMismatchException extends IllegalArgumentException {

    public DimensionMismatchException(final int expected, final int actual, final String context) {
        super("Vector dimension mismatch in " + context + ": expected " + expected + ", got " + actual
                + " (rebuild the index if the encoder changed)");
    }

    public static void check(final int expected, final int actual, final String context) {
        if (expected != actual) {
            throw new DimensionMismatchException(expected, actual, context);
        }
    }
}
