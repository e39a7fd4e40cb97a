package eu.virtualparadox.labelrecall.rag.embed;

import eu.virtualparadox.labelrecall.application.config.ApplicationConfig;
import eu.virtualparadox.labelrecall.ingest.model.Example;
import eu.virtualparadox.labelrecall.label.LabelPath;
import eu.virtualparadox.labelrecall.rag.index.DimensionMismatchException;
import eu.virtualparadox.labelrecall.rag.index.model.CorpusEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorpusEmbedderTest {

    private static final List<Example> CORPUS = List.of(
            new Example("湖人队赢得总冠军", LabelPath.of("体育", "篮球")),
            new Example("国足世预赛出线", LabelPath.of("体育", "足球")),
            new Example("高考成绩今日公布", LabelPath.of("教育")));

    @Test
    @DisplayName("Entries keep input order, labels and the shared encoder's vectors")
    void embedsInOrder() {
        final HashingProjectionEncoder encoder = new HashingProjectionEncoder(8, 256, 1, 2, true, 1L);
        final CorpusEmbedder embedder = new CorpusEmbedder(encoder, new ApplicationConfig());

        final List<CorpusEntry> entries = embedder.embedCorpus(CORPUS, 2);

        assertThat(entries).extracting(CorpusEntry::id).containsExactly(0, 1, 2);
        assertThat(entries).extracting(CorpusEntry::labelPath).containsExactly(
                LabelPath.of("体育", "篮球"), LabelPath.of("体育", "足球"), LabelPath.of("教育"));
        for (int i = 0; i < CORPUS.size(); i++) {
            assertThat(entries.get(i).vector()).containsExactly(encoder.encode(CORPUS.get(i).text()));
        }
    }

    @Test
    @DisplayName("Embedding is repeatable for fixed weights")
    void repeatable() {
        final CorpusEmbedder embedder = new CorpusEmbedder(
                new HashingProjectionEncoder(8, 256, 1, 2, true, 1L), new ApplicationConfig());

        final List<CorpusEntry> first = embedder.embedCorpus(CORPUS);
        final List<CorpusEntry> second = embedder.embedCorpus(CORPUS);

        for (int i = 0; i < first.size(); i++) {
            assertThat(second.get(i).vector()).containsExactly(first.get(i).vector());
        }
    }

    @Test
    @DisplayName("An encoder emitting the wrong width is a dimension mismatch")
    void wrongWidth() {
        final TextEncoder broken = new TextEncoder() {
            @Override
            public int dimension() {
                return 4;
            }

            @Override
            public float[] encode(final String text) {
                return new float[3];
            }

            @Override
            public String name() {
                return "broken";
            }
        };

        assertThatThrownBy(() -> new CorpusEmbedder(broken, new ApplicationConfig()).embedCorpus(CORPUS))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    @DisplayName("An empty corpus yields no entries")
    void emptyCorpus() {
        final CorpusEmbedder embedder = new CorpusEmbedder(
                new HashingProjectionEncoder(8, 256, 1, 2, true, 1L), new ApplicationConfig());

        assertThat(embedder.embedCorpus(List.of())).isEmpty();
    }
}
