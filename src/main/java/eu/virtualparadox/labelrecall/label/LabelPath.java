package eu.virtualparadox.labelrecall.label;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Hierarchical class label, ordered root-to-leaf (e.g. {@code 体育 / 篮球}).
 * <p>
 * A path always holds at least one level. In files and outputs the levels are joined
 * with the reserved {@link #SEPARATOR}, which therefore may not appear inside a level.
 *
 * @param levels label levels, root first (non-empty, no blank level)
 */
public record LabelPath(List<String> levels) implements Comparable<LabelPath> {

    /** Reserved two-character separator between hierarchy levels. */
    public static final String SEPARATOR = "##";

    private static final Pattern SPLIT = Pattern.compile(Pattern.quote(SEPARATOR));

    public LabelPath {
        if (levels == null || levels.isEmpty()) {
            throw new IllegalArgumentException("Label path must have at least one level");
        }
        for (final String level : levels) {
            if (StringUtils.isBlank(level)) {
                throw new IllegalArgumentException("Label level must not be blank: " + levels);
            }
            if (level.contains(SEPARATOR) || level.indexOf('\t') >= 0) {
                throw new IllegalArgumentException("Label level contains a reserved character: " + level);
            }
        }
        levels = List.copyOf(levels);
    }

    public static LabelPath of(final String... levels) {
        return new LabelPath(Arrays.asList(levels));
    }

    /**
     * Parses the external representation {@code level1##level2##...}.
     *
     * @param external joined label path
     * @return parsed path
     * @throws IllegalArgumentException if the value is blank or has an empty level
     */
    public static LabelPath parse(final String external) {
        if (StringUtils.isBlank(external)) {
            throw new IllegalArgumentException("Label path must not be blank");
        }
        final String[] parts = SPLIT.split(external.trim(), -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
        }
        return new LabelPath(Arrays.asList(parts));
    }

    public int depth() {
        return levels.size();
    }

    public String root() {
        return levels.get(0);
    }

    public String leaf() {
        return levels.get(levels.size() - 1);
    }

    /**
     * Keeps the first {@code depth} levels. A depth of zero or less, or one that is not
     * shorter than this path, returns the path itself.
     */
    public LabelPath truncate(final int depth) {
        if (depth <= 0 || depth >= levels.size()) {
            return this;
        }
        return new LabelPath(levels.subList(0, depth));
    }

    public String asString() {
        return String.join(SEPARATOR, levels);
    }

    @Override
    public int compareTo(final LabelPath other) {
        return asString().compareTo(other.asString());
    }

    @Override
    public String toString() {
        return asString();
    }
}
