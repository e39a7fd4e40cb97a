package eu.virtualparadox.labelrecall.rag.index.model;

import eu.virtualparadox.labelrecall.label.LabelPath;

import java.util.Objects;

/**
 * An embedded, label-bearing corpus record as stored in a vector index.
 *
 * @param id        dense index-local identifier (position in the built corpus)
 * @param text      source text the embedding was computed from
 * @param embedding the vector
 * @param labelPath label the entry votes for
 */
public record CorpusEntry(int id, String text, Embedding embedding, LabelPath labelPath) {

    public CorpusEntry {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(embedding, "embedding must not be null");
        Objects.requireNonNull(labelPath, "labelPath must not be null");
    }

    public float[] vector() {
        return embedding.vector();
    }
}
