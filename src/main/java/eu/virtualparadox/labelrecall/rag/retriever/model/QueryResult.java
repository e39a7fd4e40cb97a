package eu.virtualparadox.labelrecall.rag.retriever.model;

import java.util.List;

/**
 * Recalled neighbours of one query, best first.
 *
 * @param queryId   query identifier
 * @param neighbors neighbours ordered by descending score, at most K
 * @param complete  {@code false} when the index search hit the query timeout
 */
public record QueryResult(String queryId, List<Neighbor> neighbors, boolean complete) {

    public QueryResult {
        neighbors = List.copyOf(neighbors);
    }

    public static QueryResult empty(final String queryId) {
        return new QueryResult(queryId, List.of(), true);
    }

    public boolean isEmpty() {
        return neighbors.isEmpty();
    }
}
