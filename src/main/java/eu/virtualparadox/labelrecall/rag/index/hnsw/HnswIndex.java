package eu.virtualparadox.labelrecall.rag.index.hnsw;

import eu.virtualparadox.labelrecall.rag.index.DimensionMismatchException;
import eu.virtualparadox.labelrecall.rag.index.DistanceMetric;
import eu.virtualparadox.labelrecall.rag.index.VectorIndex;
import eu.virtualparadox.labelrecall.rag.index.model.CorpusEntry;
import eu.virtualparadox.labelrecall.rag.index.model.SearchHit;
import eu.virtualparadox.labelrecall.rag.index.model.SearchResponse;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable multi-layer HNSW graph produced by {@link HnswIndexBuilder}.
 * <p>
 * A query descends greedily from the entry point through the sparse upper layers
 * (beam width 1) and then runs a beam search of width {@code max(efSearch, k)} on
 * layer 0, which holds every node. Nothing is mutated after construction, so any
 * number of threads may search concurrently.
 */
public final class HnswIndex implements VectorIndex, NeighborSource {

    private static final int[] NO_NEIGHBORS = new int[0];

    private final List<CorpusEntry> entries;
    private final float[][] vectors;
    /** adjacency[node][layer] = neighbour ids; a node exists on layers 0..adjacency[node].length-1. */
    private final int[][][] adjacency;
    private final int entryPoint;
    private final int maxLevel;
    private final int dimension;
    private final DistanceMetric metric;
    private final GraphSearcher searcher;

    HnswIndex(final List<CorpusEntry> entries,
              final float[][] vectors,
              final int[][][] adjacency,
              final int entryPoint,
              final int maxLevel,
              final DistanceMetric metric) {
        this.entries = List.copyOf(entries);
        this.vectors = vectors;
        this.adjacency = adjacency;
        this.entryPoint = entryPoint;
        this.maxLevel = maxLevel;
        this.dimension = vectors.length == 0 ? 0 : vectors[0].length;
        this.metric = metric;
        this.searcher = new GraphSearcher(vectors, this, metric);
    }

    static HnswIndex empty(final DistanceMetric metric) {
        return new HnswIndex(List.of(), new float[0][], new int[0][][], -1, -1, metric);
    }

    @Override
    public List<SearchHit> search(final float[] query, final int k, final int efSearch) {
        return search(query, k, efSearch, null).hits();
    }

    @Override
    public SearchResponse search(final float[] query, final int k, final int efSearch, final Duration timeout) {
        if (isEmpty() || k <= 0) {
            return SearchResponse.empty();
        }
        DimensionMismatchException.check(dimension, query.length, "HNSW search");

        final Deadline deadline = Deadline.after(timeout);
        List<Candidate> entryPoints = List.of(new Candidate(entryPoint, searcher.distance(query, entryPoint)));

        for (int layer = maxLevel; layer > 0; layer--) {
            final GraphSearcher.LayerResult descent = searcher.searchLayer(query, entryPoints, 1, layer, deadline);
            entryPoints = descent.closest();
            if (descent.timedOut()) {
                return toResponse(descent.nearest(), k, false);
            }
        }

        final GraphSearcher.LayerResult base =
                searcher.searchLayer(query, entryPoints, Math.max(efSearch, k), 0, deadline);
        return toResponse(base.nearest(), k, !base.timedOut());
    }

    private SearchResponse toResponse(final List<Candidate> nearest, final int k, final boolean complete) {
        final int limit = Math.min(k, nearest.size());
        final List<SearchHit> hits = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            final Candidate c = nearest.get(i);
            hits.add(new SearchHit(c.node(), c.distance()));
        }
        return new SearchResponse(hits, complete);
    }

    @Override
    public int[] neighbors(final int node, final int layer) {
        final int[][] layers = adjacency[node];
        return layer < layers.length ? layers[layer] : NO_NEIGHBORS;
    }

    @Override
    public CorpusEntry entry(final int entryId) {
        return entries.get(entryId);
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public DistanceMetric metric() {
        return metric;
    }

    /**
     * @return highest layer of the graph, {@code -1} when empty
     */
    public int maxLevel() {
        return maxLevel;
    }

    /**
     * @return number of nodes present on {@code layer}
     */
    public int layerSize(final int layer) {
        int count = 0;
        for (final int[][] layers : adjacency) {
            if (layer < layers.length) {
                count++;
            }
        }
        return count;
    }
}
