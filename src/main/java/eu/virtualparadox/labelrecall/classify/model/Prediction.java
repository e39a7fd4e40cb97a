package eu.virtualparadox.labelrecall.classify.model;

import eu.virtualparadox.labelrecall.label.LabelPath;

import java.util.Objects;

/**
 * Classifier output for one query.
 *
 * @param queryId    query identifier
 * @param labelPath  predicted label, {@code null} when unclassified
 * @param confidence weight of the winning group (or top score for best match); {@code 0} when unclassified
 */
public record Prediction(String queryId, LabelPath labelPath, double confidence) {

    /** Rendered instead of a label when no prediction was made. */
    public static final String UNCLASSIFIED = "UNCLASSIFIED";

    public Prediction {
        Objects.requireNonNull(queryId, "queryId must not be null");
    }

    public static Prediction unclassified(final String queryId) {
        return new Prediction(queryId, null, 0.0);
    }

    public boolean isClassified() {
        return labelPath != null;
    }

    public String labelAsString() {
        return labelPath == null ? UNCLASSIFIED : labelPath.asString();
    }
}
