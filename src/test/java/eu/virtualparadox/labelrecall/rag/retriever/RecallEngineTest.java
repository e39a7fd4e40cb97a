package eu.virtualparadox.labelrecall.rag.retriever;

import eu.virtualparadox.labelrecall.application.config.ApplicationConfig;
import eu.virtualparadox.labelrecall.rag.embed.FixedVectorEncoder;
import eu.virtualparadox.labelrecall.rag.index.ActiveIndexRegistry;
import eu.virtualparadox.labelrecall.rag.index.VectorIndex;
import eu.virtualparadox.labelrecall.rag.retriever.model.Neighbor;
import eu.virtualparadox.labelrecall.rag.retriever.model.QueryResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RecallEngineTest {

    private FixedVectorEncoder encoder;
    private ActiveIndexRegistry registry;
    private RecallEngine engine;

    @BeforeEach
    void setUp() {
        encoder = TopicCorpus.encoder();
        registry = new ActiveIndexRegistry();
        engine = new RecallEngine(encoder, registry, new ApplicationConfig());
    }

    @Test
    @DisplayName("Neighbours are ranked 1..n by descending cosine score")
    void ranksByScore() {
        registry.activate(TopicCorpus.index(encoder));

        final QueryResult result = engine.recall("q-1", TopicCorpus.FOOTBALL_QUERY, 3);

        assertThat(result.queryId()).isEqualTo("q-1");
        assertThat(result.complete()).isTrue();
        assertThat(result.neighbors()).extracting(Neighbor::rank).containsExactly(1, 2, 3);
        assertThat(result.neighbors()).extracting(Neighbor::entryId).containsExactly(1, 0, 2);
        assertThat(result.neighbors()).extracting(Neighbor::labelPath).containsExactly(
                TopicCorpus.BASKETBALL, TopicCorpus.BASKETBALL, TopicCorpus.FOOTBALL);

        final List<Neighbor> neighbors = result.neighbors();
        for (int i = 1; i < neighbors.size(); i++) {
            assertThat(neighbors.get(i).score()).isLessThanOrEqualTo(neighbors.get(i - 1).score());
        }
        // cos((0.9, 0.3), (1, 0))
        assertThat(neighbors.get(1).score()).isCloseTo(0.9f / (float) Math.sqrt(0.9), within(1e-4f));
    }

    @Test
    @DisplayName("K = 1 returns only the nearest entry")
    void nearestOnly() {
        registry.activate(TopicCorpus.index(encoder));

        final QueryResult result = engine.recall("q-1", TopicCorpus.BASKETBALL_QUERY, 1);

        assertThat(result.neighbors()).hasSize(1);
        assertThat(result.neighbors().get(0).entryId()).isZero();
        assertThat(result.neighbors().get(0).labelPath()).isEqualTo(TopicCorpus.BASKETBALL);
    }

    @Test
    @DisplayName("K larger than the corpus returns every entry")
    void kLargerThanCorpus() {
        final VectorIndex index = TopicCorpus.index(encoder);

        final QueryResult result = engine.recall("q-1", TopicCorpus.EDUCATION_QUERY, 50, index);

        assertThat(result.neighbors()).hasSize(TopicCorpus.CORPUS.size());
        assertThat(result.neighbors().get(0).labelPath()).isEqualTo(TopicCorpus.EDUCATION);
    }

    @Test
    @DisplayName("Non-positive K yields an empty result")
    void nonPositiveK() {
        final VectorIndex index = TopicCorpus.index(encoder);

        assertThat(engine.recall("q-1", TopicCorpus.BASKETBALL_QUERY, 0, index).isEmpty()).isTrue();
        assertThat(engine.recall("q-2", TopicCorpus.BASKETBALL_QUERY, -3, index).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Querying without an active index fails")
    void noActiveIndex() {
        assertThatThrownBy(() -> engine.recall("q-1", TopicCorpus.BASKETBALL_QUERY, 5))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No active index");
    }
}
