package eu.virtualparadox.labelrecall.rag.retriever.model;

import eu.virtualparadox.labelrecall.label.LabelPath;

/**
 * @param rank      1-based position in the recall list
 * @param entryId   identifier of the corpus entry
 * @param labelPath label of the corpus entry
 * @param score     similarity score (higher = better)
 * @param distance  distance under the index metric (lower = better)
 */
public record Neighbor(int rank, int entryId, LabelPath labelPath, float score, float distance) {

}
