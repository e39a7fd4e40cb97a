package eu.virtualparadox.labelrecall.rag.embed;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps text to a fixed-length dense vector.
 * <p>
 * One instance serves both the query side and the corpus side, so queries and label
 * entries always live in the same embedding space. Implementations must be deterministic
 * for fixed weights.
 */
public interface TextEncoder {

    /**
     * @return length of every vector this encoder produces
     */
    int dimension();

    /**
     * Embeds a single text.
     *
     * @param text the text (non-null)
     * @return a vector of length {@link #dimension()}
     */
    float[] encode(final String text);

    /**
     * Embeds texts in batch.
     *
     * @param texts list of texts
     * @return one vector per text, in input order
     */
    default List<float[]> encodeBatch(final List<String> texts) {
        final List<float[]> out = new ArrayList<>(texts.size());
        for (final String text : texts) {
            out.add(encode(text));
        }
        return out;
    }

    /**
     * @return short identifier used in logs
     */
    String name();
}
