package eu.virtualparadox.labelrecall.rag.index.hnsw;

/**
 * Read access to graph adjacency, shared by the builder's growing graph and the frozen index.
 */
interface NeighborSource {

    /**
     * @return neighbours of {@code node} on {@code layer}; empty if the node is not on that layer
     */
    int[] neighbors(final int node, final int layer);
}
