package eu.virtualparadox.labelrecall.ingest.model;

import eu.virtualparadox.labelrecall.label.LabelPath;

import java.util.Objects;

/**
 * A text paired with its hierarchical label.
 * <p>Used both as a corpus record (label-bearing entry to index) and as a golden example.</p>
 */
public record Example(String text, LabelPath labelPath) {

    public Example {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(labelPath, "labelPath must not be null");
    }
}
