package eu.virtualparadox.labelrecall.label;

/**
 * Label-path comparison shared by voting and evaluation, so both agree on what
 * "same label at depth d" means.
 */
public final class LabelPaths {

    /** Comparison depth meaning "compare the full path". */
    public static final int FULL_DEPTH = 0;

    private LabelPaths() {
        // prevent instantiation
    }

    /**
     * Compares two label paths on their first {@code comparisonDepth} levels.
     * <p>
     * A depth of {@link #FULL_DEPTH} (or any value &lt;= 0) compares the complete paths.
     * When one path is shorter than the requested depth it must match the other path's
     * prefix of the same requested depth exactly, so {@code 体育} does not match
     * {@code 体育##篮球} at depth 2.
     *
     * @param a               first path, may be {@code null}
     * @param b               second path, may be {@code null}
     * @param comparisonDepth number of levels to compare, {@code <= 0} for all
     * @return {@code true} if both are non-null and equal at the requested depth
     */
    public static boolean matches(final LabelPath a, final LabelPath b, final int comparisonDepth) {
        if (a == null || b == null) {
            return false;
        }
        return comparisonKey(a, comparisonDepth).equals(comparisonKey(b, comparisonDepth));
    }

    /**
     * The part of {@code path} that {@link #matches(LabelPath, LabelPath, int)} looks at:
     * two paths match at a depth exactly when their keys at that depth are equal.
     * Voting groups neighbours by this key.
     *
     * @param path            the label path (non-null)
     * @param comparisonDepth number of levels to keep, {@code <= 0} for all
     */
    public static LabelPath comparisonKey(final LabelPath path, final int comparisonDepth) {
        return comparisonDepth <= FULL_DEPTH ? path : path.truncate(comparisonDepth);
    }
}
