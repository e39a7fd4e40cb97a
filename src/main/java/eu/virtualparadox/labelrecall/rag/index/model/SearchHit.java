package eu.virtualparadox.labelrecall.rag.index.model;

/**
 * @param entryId  identifier of the matched {@link CorpusEntry}
 * @param distance distance to the query under the index metric (lower = closer)
 */
public record SearchHit(int entryId, float distance) {

}
