package eu.virtualparadox.labelrecall.rag.index.hnsw;

import eu.virtualparadox.labelrecall.rag.index.DistanceMetric;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Beam search over one layer of an HNSW graph, used both while inserting nodes and
 * while answering queries.
 * <p>
 * Keeps a min-heap of nodes still to expand and a bounded max-heap of the best
 * {@code ef} nodes seen. Expansion stops when the closest unexpanded node is further
 * than the worst kept result, or when the deadline expires.
 */
final class GraphSearcher {

    private final float[][] vectors;
    private final NeighborSource graph;
    private final DistanceMetric metric;

    GraphSearcher(final float[][] vectors, final NeighborSource graph, final DistanceMetric metric) {
        this.vectors = vectors;
        this.graph = graph;
        this.metric = metric;
    }

    float distance(final float[] query, final int node) {
        return metric.distance(query, vectors[node]);
    }

    /**
     * Searches one layer starting from {@code entryPoints}.
     *
     * @return the best {@code ef} nodes seen, nearest first
     */
    LayerResult searchLayer(final float[] query,
                            final List<Candidate> entryPoints,
                            final int ef,
                            final int layer,
                            final Deadline deadline) {
        final BitSet visited = new BitSet(vectors.length);
        final PriorityQueue<Candidate> toExpand = new PriorityQueue<>(Candidate.NEAREST_FIRST);
        final PriorityQueue<Candidate> best = new PriorityQueue<>(Candidate.FURTHEST_FIRST);

        for (final Candidate ep : entryPoints) {
            if (visited.get(ep.node())) {
                continue;
            }
            visited.set(ep.node());
            toExpand.add(ep);
            best.add(ep);
            if (best.size() > ef) {
                best.poll();
            }
        }

        boolean timedOut = false;
        while (!toExpand.isEmpty()) {
            if (deadline.expired()) {
                timedOut = true;
                break;
            }
            final Candidate current = toExpand.poll();
            if (best.size() >= ef && current.distance() > best.peek().distance()) {
                break;
            }
            for (final int neighbor : graph.neighbors(current.node(), layer)) {
                if (visited.get(neighbor)) {
                    continue;
                }
                visited.set(neighbor);
                final float d = distance(query, neighbor);
                if (best.size() < ef || d < best.peek().distance()) {
                    final Candidate candidate = new Candidate(neighbor, d);
                    toExpand.add(candidate);
                    best.add(candidate);
                    if (best.size() > ef) {
                        best.poll();
                    }
                }
            }
        }

        final List<Candidate> sorted = new ArrayList<>(best);
        sorted.sort(Candidate.NEAREST_FIRST);
        return new LayerResult(sorted, timedOut);
    }

    /**
     * @param nearest  results, nearest first
     * @param timedOut whether the deadline cut the walk short
     */
    record LayerResult(List<Candidate> nearest, boolean timedOut) {

        List<Candidate> closest() {
            return nearest.isEmpty() ? nearest : nearest.subList(0, 1);
        }
    }
}
