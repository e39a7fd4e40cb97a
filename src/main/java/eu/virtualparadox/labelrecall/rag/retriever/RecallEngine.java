package eu.virtualparadox.labelrecall.rag.retriever;

import eu.virtualparadox.labelrecall.application.config.ApplicationConfig;
import eu.virtualparadox.labelrecall.rag.embed.TextEncoder;
import eu.virtualparadox.labelrecall.rag.index.ActiveIndexRegistry;
import eu.virtualparadox.labelrecall.rag.index.DistanceMetric;
import eu.virtualparadox.labelrecall.rag.index.IndexLease;
import eu.virtualparadox.labelrecall.rag.index.VectorIndex;
import eu.virtualparadox.labelrecall.rag.index.model.CorpusEntry;
import eu.virtualparadox.labelrecall.rag.index.model.SearchHit;
import eu.virtualparadox.labelrecall.rag.index.model.SearchResponse;
import eu.virtualparadox.labelrecall.rag.retriever.model.Neighbor;
import eu.virtualparadox.labelrecall.rag.retriever.model.QueryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Retrieves the K corpus entries nearest to a query.
 * <p>
 * Steps:
 * <ol>
 *   <li>Embed the query with the shared {@link TextEncoder}</li>
 *   <li>Search the index with the configured {@code efSearch} and query timeout</li>
 *   <li>Convert the hits into ranked {@link Neighbor}s carrying label and similarity score</li>
 * </ol>
 * The index-less overloads lease the active index from {@link ActiveIndexRegistry} for the
 * duration of one query, so a concurrent rebuild never pulls it away mid-search.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecallEngine {

    private final TextEncoder encoder;
    private final ActiveIndexRegistry registry;
    private final ApplicationConfig applicationConfig;

    /**
     * Recalls against the active index.
     *
     * @throws IllegalStateException if no index has been activated
     */
    public QueryResult recall(final String queryId, final String text, final int k) {
        try (IndexLease lease = registry.acquire()) {
            if (!lease.isPresent()) {
                throw new IllegalStateException("No active index: build one before querying");
            }
            return recall(queryId, text, k, lease.index());
        }
    }

    public QueryResult recall(final String queryId, final String text, final int k, final VectorIndex index) {
        return recallVector(queryId, encoder.encode(text), k, index);
    }

    /**
     * Recalls with an already embedded query.
     *
     * @param k maximum number of neighbours; non-positive yields an empty result
     * @return neighbours ranked 1..n by descending score, {@code n <= k}
     */
    public QueryResult recallVector(final String queryId, final float[] vector, final int k, final VectorIndex index) {
        if (k <= 0 || index.isEmpty()) {
            return QueryResult.empty(queryId);
        }
        final ApplicationConfig.Index settings = applicationConfig.getIndex();
        final SearchResponse response = index.search(vector, k, settings.getEfSearch(), settings.getQueryTimeout());
        if (!response.complete()) {
            log.warn("Query {} timed out after {}, returning {} partial neighbours",
                    queryId, settings.getQueryTimeout(), response.hits().size());
        }

        final DistanceMetric metric = index.metric();
        final List<Neighbor> neighbors = new ArrayList<>(response.hits().size());
        for (final SearchHit hit : response.hits()) {
            final CorpusEntry entry = index.entry(hit.entryId());
            neighbors.add(new Neighbor(neighbors.size() + 1, entry.id(), entry.labelPath(),
                    metric.toScore(hit.distance()), hit.distance()));
        }
        printDebugNeighbors(queryId, neighbors);
        return new QueryResult(queryId, neighbors, response.complete());
    }

    private void printDebugNeighbors(final String queryId, final List<Neighbor> neighbors) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final Neighbor n : neighbors) {
            sb.append(" - #").append(n.rank()).append(" [").append(n.score()).append("] ")
                    .append(n.labelPath().asString()).append("\n");
        }
        log.debug("Recalled for {}:\n{}", queryId, sb);
    }
}
