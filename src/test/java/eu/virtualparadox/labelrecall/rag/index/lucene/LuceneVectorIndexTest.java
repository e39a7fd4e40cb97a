package eu.virtualparadox.labelrecall.rag.index.lucene;

import eu.virtualparadox.labelrecall.label.LabelPath;
import eu.virtualparadox.labelrecall.rag.index.DimensionMismatchException;
import eu.virtualparadox.labelrecall.rag.index.DistanceMetric;
import eu.virtualparadox.labelrecall.rag.index.IndexBackend;
import eu.virtualparadox.labelrecall.rag.index.IndexConfig;
import eu.virtualparadox.labelrecall.rag.index.VectorIndex;
import eu.virtualparadox.labelrecall.rag.index.model.CorpusEntry;
import eu.virtualparadox.labelrecall.rag.index.model.SearchHit;
import eu.virtualparadox.labelrecall.rag.index.model.SearchResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.List;
import java.util.Random;

import static eu.virtualparadox.labelrecall.rag.index.IndexFixtures.bruteForce;
import static eu.virtualparadox.labelrecall.rag.index.IndexFixtures.entry;
import static eu.virtualparadox.labelrecall.rag.index.IndexFixtures.randomEntries;
import static eu.virtualparadox.labelrecall.rag.index.IndexFixtures.randomVector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class LuceneVectorIndexTest {

    private final LuceneVectorIndexBuilder builder = new LuceneVectorIndexBuilder();

    private static IndexConfig lucene(final DistanceMetric metric) {
        return new IndexConfig(IndexBackend.LUCENE, metric, 40, 200, 42L);
    }

    @ParameterizedTest
    @EnumSource(DistanceMetric.class)
    @DisplayName("Small corpus searches agree with brute force under every metric")
    void agreesWithBruteForce(final DistanceMetric metric) {
        final List<CorpusEntry> entries = randomEntries(40, 8, 17L);
        try (VectorIndex index = builder.build(entries, lucene(metric))) {
            assertThat(index.size()).isEqualTo(40);
            assertThat(index.dimension()).isEqualTo(8);

            final Random random = new Random(3L);
            for (int q = 0; q < 10; q++) {
                final float[] query = randomVector(random, 8);
                assertThat(index.search(query, 5, 40))
                        .extracting(SearchHit::entryId)
                        .containsExactlyElementsOf(bruteForce(entries, query, 5, metric));
            }
        }
    }

    @Test
    @DisplayName("Distances are reported with the configured metric")
    void distancesUseConfiguredMetric() {
        final List<CorpusEntry> entries = List.of(
                entry(0, new float[]{1f, 0f}, LabelPath.of("x")),
                entry(1, new float[]{0f, 1f}, LabelPath.of("y")));
        try (VectorIndex index = builder.build(entries, lucene(DistanceMetric.COSINE))) {
            final List<SearchHit> hits = index.search(new float[]{1f, 0f}, 2, 10);

            assertThat(hits).extracting(SearchHit::entryId).containsExactly(0, 1);
            assertThat(hits.get(0).distance()).isCloseTo(0f, offset(1e-6f));
            assertThat(hits.get(1).distance()).isCloseTo(1f, offset(1e-6f));
        }
    }

    @Test
    @DisplayName("Timed searches are always complete")
    void timedSearchIsComplete() {
        try (VectorIndex index = builder.build(randomEntries(20, 4, 5L), lucene(DistanceMetric.L2))) {
            final SearchResponse response = index.search(new float[]{0f, 0f, 0f, 0f}, 3, 10, Duration.ofNanos(1));

            assertThat(response.complete()).isTrue();
            assertThat(response.hits()).hasSize(3);
        }
    }

    @Test
    @DisplayName("A zero cosine query returns equidistant hits, a zero cosine entry fails the build")
    void zeroVectors() {
        try (VectorIndex index = builder.build(randomEntries(6, 4, 5L), lucene(DistanceMetric.COSINE))) {
            assertThat(index.search(new float[4], 3, 10))
                    .hasSize(3)
                    .allSatisfy(hit -> assertThat(hit.distance()).isEqualTo(1.0f));
        }

        final List<CorpusEntry> withZero = List.of(
                entry(0, new float[]{1f, 0f}, LabelPath.of("x")),
                entry(1, new float[]{0f, 0f}, LabelPath.of("empty")));
        assertThatThrownBy(() -> builder.build(withZero, lucene(DistanceMetric.COSINE)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("entry 1");
    }

    @Test
    @DisplayName("Empty corpus and wrong query dimension")
    void edgeCases() {
        try (VectorIndex empty = builder.build(List.of(), lucene(DistanceMetric.COSINE))) {
            assertThat(empty.search(new float[]{1f}, 3, 10)).isEmpty();
        }
        try (VectorIndex index = builder.build(randomEntries(5, 4, 5L), lucene(DistanceMetric.COSINE))) {
            assertThatThrownBy(() -> index.search(new float[2], 3, 10))
                    .isInstanceOf(DimensionMismatchException.class);
        }
    }
}
