package eu.virtualparadox.labelrecall.rag.index.hnsw;

import java.util.Comparator;

/**
 * A graph node together with its distance to the current query.
 */
record Candidate(int node, float distance) {

    /** Closest first; node id breaks ties so walks are reproducible. */
    static final Comparator<Candidate> NEAREST_FIRST =
            Comparator.comparingDouble(Candidate::distance).thenComparingInt(Candidate::node);

    static final Comparator<Candidate> FURTHEST_FIRST = NEAREST_FIRST.reversed();
}
