package eu.virtualparadox.labelrecall.ingest.model;

import java.util.Objects;

/**
 * One row of a training batch: a query text and the text (or label text) it should retrieve.
 */
public record TrainingPair(String query, String positive) {

    public TrainingPair {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(positive, "positive must not be null");
    }
}
