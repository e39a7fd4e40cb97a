package eu.virtualparadox.labelrecall.rag.index.model;

import java.util.List;

/**
 * Result of a time-bounded index search.
 *
 * @param hits     hits ordered by ascending distance
 * @param complete {@code false} when the deadline stopped the graph walk early
 */
public record SearchResponse(List<SearchHit> hits, boolean complete) {

    public SearchResponse {
        hits = List.copyOf(hits);
    }

    public static SearchResponse empty() {
        return new SearchResponse(List.of(), true);
    }
}
