package eu.virtualparadox.labelrecall.query;

import eu.virtualparadox.labelrecall.application.config.ApplicationConfig;
import eu.virtualparadox.labelrecall.application.executor.QueryExecutor;
import eu.virtualparadox.labelrecall.classify.VotingClassifier;
import eu.virtualparadox.labelrecall.classify.model.Prediction;
import eu.virtualparadox.labelrecall.classify.model.VotingStrategy;
import eu.virtualparadox.labelrecall.ingest.cleaner.TextCleaner;
import eu.virtualparadox.labelrecall.rag.embed.FixedVectorEncoder;
import eu.virtualparadox.labelrecall.rag.index.ActiveIndexRegistry;
import eu.virtualparadox.labelrecall.rag.retriever.RecallEngine;
import eu.virtualparadox.labelrecall.rag.retriever.TopicCorpus;
import eu.virtualparadox.labelrecall.rag.retriever.model.QueryResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassificationManagerTest {

    private QueryExecutor executor;
    private ApplicationConfig config;
    private ActiveIndexRegistry registry;
    private ClassificationManager manager;
    private FixedVectorEncoder encoder;

    @BeforeEach
    void setUp() {
        executor = new QueryExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setThreadNamePrefix("query-test-");
        executor.initialize();

        encoder = TopicCorpus.encoder();
        config = new ApplicationConfig();
        config.getVoting().setTopK(1);
        registry = new ActiveIndexRegistry();
        manager = new ClassificationManager(new RecallEngine(encoder, registry, config), new VotingClassifier(),
                registry, executor, new TextCleaner(), config);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("With K = 1 a query takes the label of its nearest corpus entry")
    void nearestLabel() {
        registry.activate(TopicCorpus.index(encoder));

        assertThat(manager.classify(TopicCorpus.BASKETBALL_QUERY).labelPath()).isEqualTo(TopicCorpus.BASKETBALL);
        assertThat(manager.classify(TopicCorpus.EDUCATION_QUERY).labelPath()).isEqualTo(TopicCorpus.EDUCATION);
        // nearest entry is basketball although the text is about football
        assertThat(manager.classify(TopicCorpus.FOOTBALL_QUERY).labelPath()).isEqualTo(TopicCorpus.BASKETBALL);
    }

    @Test
    @DisplayName("A best match below the confidence threshold is left unclassified")
    void belowThreshold() {
        registry.activate(TopicCorpus.index(encoder));
        config.getVoting().setStrategy(VotingStrategy.BEST_MATCH);
        config.getVoting().setMinConfidence(0.999);

        final Prediction prediction = manager.classify(TopicCorpus.BASKETBALL_QUERY);

        assertThat(prediction.isClassified()).isFalse();
        assertThat(prediction.labelAsString()).isEqualTo(Prediction.UNCLASSIFIED);

        config.getVoting().setMinConfidence(0.99);
        assertThat(manager.classify(TopicCorpus.BASKETBALL_QUERY).labelPath()).isEqualTo(TopicCorpus.BASKETBALL);
    }

    @Test
    @DisplayName("Query text is cleaned before it is embedded")
    void cleansText() {
        registry.activate(TopicCorpus.index(encoder));

        final QueryResult result = manager.recall("  " + TopicCorpus.EDUCATION_QUERY + "\n");

        assertThat(result.neighbors()).hasSize(1);
        assertThat(result.neighbors().get(0).labelPath()).isEqualTo(TopicCorpus.EDUCATION);
    }

    @Test
    @DisplayName("Batch prediction keeps input order and counts abstentions")
    void batch() {
        registry.activate(TopicCorpus.index(encoder));
        config.getVoting().setMinConfidence(0.9990);

        final BatchReport report = manager.predictBatch(List.of(
                TopicCorpus.BASKETBALL_QUERY, TopicCorpus.FOOTBALL_QUERY, "\t" + TopicCorpus.EDUCATION_QUERY));

        assertThat(report.size()).isEqualTo(3);
        assertThat(report.texts()).containsExactly(
                TopicCorpus.BASKETBALL_QUERY, TopicCorpus.FOOTBALL_QUERY, TopicCorpus.EDUCATION_QUERY);
        assertThat(report.predictions()).extracting(Prediction::labelAsString)
                .containsExactly(Prediction.UNCLASSIFIED, "体育##篮球", Prediction.UNCLASSIFIED);
        assertThat(report.unclassified()).isEqualTo(2);
        assertThat(report.timedOut()).isZero();
    }

    @Test
    @DisplayName("Prediction without an active index fails")
    void noIndex() {
        assertThatThrownBy(() -> manager.predictBatch(List.of(TopicCorpus.BASKETBALL_QUERY)))
                .isInstanceOf(IllegalStateException.class);
    }
}
