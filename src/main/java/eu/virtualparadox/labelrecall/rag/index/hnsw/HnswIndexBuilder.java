package eu.virtualparadox.labelrecall.rag.index.hnsw;

import eu.virtualparadox.labelrecall.rag.index.DimensionMismatchException;
import eu.virtualparadox.labelrecall.rag.index.DistanceMetric;
import eu.virtualparadox.labelrecall.rag.index.IndexBackend;
import eu.virtualparadox.labelrecall.rag.index.IndexConfig;
import eu.virtualparadox.labelrecall.rag.index.VectorIndex;
import eu.virtualparadox.labelrecall.rag.index.VectorIndexBuilder;
import eu.virtualparadox.labelrecall.rag.index.model.CorpusEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Builds a hierarchical navigable small-world graph by inserting entries one at a time.
 * <p>
 * Each node draws a top layer {@code floor(-ln(U) / ln(m))} from a seeded {@link Random},
 * so layer density decreases exponentially. Insertion descends greedily to the node's
 * top layer, then on every layer it joins runs a beam search of width
 * {@code max(efConstruction, m)}, links bidirectionally to the {@code m} nearest nodes
 * found and prunes any neighbour list that overflows ({@code m} on upper layers,
 * {@code 2m} on layer 0) back to its closest members.
 * <p>
 * The graph depends on insertion order and seed only: the same entries and config
 * always produce the same index. With {@code m >= n - 1} every node links to every
 * other node and search becomes exact.
 */
@Slf4j
@Component
public final class HnswIndexBuilder implements VectorIndexBuilder {

    private static final int MAX_LEVEL_CAP = 32;
    private static final int INITIAL_NEIGHBOR_CAPACITY = 64;

    @Override
    public IndexBackend backend() {
        return IndexBackend.HNSW;
    }

    @Override
    public VectorIndex build(final List<CorpusEntry> entries, final IndexConfig config) {
        if (entries.isEmpty()) {
            log.warn("Building an empty HNSW index: corpus has no entries");
            return HnswIndex.empty(config.metric());
        }

        final float[][] vectors = collectVectors(entries);
        final long start = System.nanoTime();

        final Construction construction = new Construction(vectors, config);
        for (int node = 0; node < vectors.length; node++) {
            construction.insert(node);
        }
        final HnswIndex index = construction.freeze(entries);

        log.info("Built HNSW index: {} entries, dim={}, metric={}, m={}, efConstruction={}, layers={} in {} ms",
                entries.size(), vectors[0].length, config.metric(), config.m(), config.efConstruction(),
                index.maxLevel() + 1, (System.nanoTime() - start) / 1_000_000);
        return index;
    }

    private static float[][] collectVectors(final List<CorpusEntry> entries) {
        final int dim = entries.get(0).embedding().dim();
        final float[][] vectors = new float[entries.size()][];
        for (int i = 0; i < entries.size(); i++) {
            final CorpusEntry entry = entries.get(i);
            if (entry.id() != i) {
                throw new IllegalArgumentException("Entry at position " + i + " has id " + entry.id());
            }
            DimensionMismatchException.check(dim, entry.embedding().dim(), "HNSW build (entry " + i + ")");
            vectors[i] = entry.vector();
        }
        return vectors;
    }

    /**
     * Mutable graph state for one build.
     */
    private static final class Construction implements NeighborSource {

        private final float[][] vectors;
        private final DistanceMetric metric;
        private final int m;
        private final int efConstruction;
        private final double levelMultiplier;
        private final Random random;
        private final NeighborList[][] layers;
        private final GraphSearcher searcher;

        private int entryPoint = -1;
        private int maxLevel = -1;

        Construction(final float[][] vectors, final IndexConfig config) {
            this.vectors = vectors;
            this.metric = config.metric();
            this.m = config.m();
            this.efConstruction = Math.max(config.efConstruction(), config.m());
            this.levelMultiplier = 1.0 / Math.log(config.m());
            this.random = new Random(config.seed());
            this.layers = new NeighborList[vectors.length][];
            this.searcher = new GraphSearcher(vectors, this, metric);
        }

        void insert(final int node) {
            final int level = randomLevel();
            layers[node] = new NeighborList[level + 1];
            for (int l = 0; l <= level; l++) {
                layers[node][l] = new NeighborList(Math.min(maxConnections(l) + 1, INITIAL_NEIGHBOR_CAPACITY));
            }

            if (entryPoint < 0) {
                entryPoint = node;
                maxLevel = level;
                return;
            }

            final float[] query = vectors[node];
            List<Candidate> entryPoints = List.of(new Candidate(entryPoint, searcher.distance(query, entryPoint)));

            for (int layer = maxLevel; layer > level; layer--) {
                entryPoints = searcher.searchLayer(query, entryPoints, 1, layer, Deadline.none()).closest();
            }

            for (int layer = Math.min(level, maxLevel); layer >= 0; layer--) {
                final List<Candidate> found =
                        searcher.searchLayer(query, entryPoints, efConstruction, layer, Deadline.none()).nearest();
                final int connections = Math.min(m, found.size());
                for (int i = 0; i < connections; i++) {
                    final int neighbor = found.get(i).node();
                    link(node, neighbor, layer);
                    link(neighbor, node, layer);
                }
                entryPoints = found;
            }

            if (level > maxLevel) {
                maxLevel = level;
                entryPoint = node;
            }
        }

        private void link(final int from, final int to, final int layer) {
            final NeighborList list = layers[from][layer];
            if (list.contains(to)) {
                return;
            }
            list.add(to);
            final int limit = maxConnections(layer);
            if (list.size() > limit) {
                prune(from, list, limit);
            }
        }

        private void prune(final int owner, final NeighborList list, final int limit) {
            final Candidate[] scored = new Candidate[list.size()];
            for (int i = 0; i < list.size(); i++) {
                final int n = list.get(i);
                scored[i] = new Candidate(n, metric.distance(vectors[owner], vectors[n]));
            }
            Arrays.sort(scored, Candidate.NEAREST_FIRST);
            list.clear();
            for (int i = 0; i < limit; i++) {
                list.add(scored[i].node());
            }
        }

        private int maxConnections(final int layer) {
            return layer == 0 ? 2 * m : m;
        }

        private int randomLevel() {
            // 1 - nextDouble() lies in (0, 1], keeping the logarithm finite
            final double u = 1.0 - random.nextDouble();
            return Math.min(MAX_LEVEL_CAP, (int) Math.floor(-Math.log(u) * levelMultiplier));
        }

        @Override
        public int[] neighbors(final int node, final int layer) {
            final NeighborList[] nodeLayers = layers[node];
            return layer < nodeLayers.length ? nodeLayers[layer].toArray() : new int[0];
        }

        HnswIndex freeze(final List<CorpusEntry> entries) {
            final int[][][] adjacency = new int[vectors.length][][];
            for (int node = 0; node < vectors.length; node++) {
                adjacency[node] = new int[layers[node].length][];
                for (int l = 0; l < layers[node].length; l++) {
                    adjacency[node][l] = layers[node][l].toArray();
                }
            }
            return new HnswIndex(entries, vectors, adjacency, entryPoint, maxLevel, metric);
        }
    }

    /**
     * Growable int list sized for one node's neighbours.
     */
    private static final class NeighborList {

        private int[] nodes;
        private int size;

        NeighborList(final int initialCapacity) {
            this.nodes = new int[Math.max(1, initialCapacity)];
        }

        void add(final int node) {
            if (size == nodes.length) {
                nodes = Arrays.copyOf(nodes, size * 2);
            }
            nodes[size++] = node;
        }

        boolean contains(final int node) {
            for (int i = 0; i < size; i++) {
                if (nodes[i] == node) {
                    return true;
                }
            }
            return false;
        }

        int get(final int i) {
            return nodes[i];
        }

        int size() {
            return size;
        }

        void clear() {
            size = 0;
        }

        int[] toArray() {
            return Arrays.copyOf(nodes, size);
        }
    }
}
