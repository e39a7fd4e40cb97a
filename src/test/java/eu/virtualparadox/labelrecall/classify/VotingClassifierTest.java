package eu.virtualparadox.labelrecall.classify;

import eu.virtualparadox.labelrecall.classify.model.Prediction;
import eu.virtualparadox.labelrecall.classify.model.VotingConfig;
import eu.virtualparadox.labelrecall.classify.model.WeightingScheme;
import eu.virtualparadox.labelrecall.label.LabelPath;
import eu.virtualparadox.labelrecall.rag.retriever.model.Neighbor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VotingClassifierTest {

    private static final LabelPath BASKETBALL = LabelPath.of("体育", "篮球");
    private static final LabelPath FOOTBALL = LabelPath.of("体育", "足球");
    private static final LabelPath EDUCATION = LabelPath.of("教育");

    private final VotingClassifier classifier = new VotingClassifier();

    /**
     * Builds neighbours ranked in the given order; distance is {@code 1 - score}.
     */
    private static List<Neighbor> neighbors(final Object... labelAndScore) {
        final List<Neighbor> out = new ArrayList<>();
        for (int i = 0; i < labelAndScore.length; i += 2) {
            final float score = ((Number) labelAndScore[i + 1]).floatValue();
            out.add(new Neighbor(out.size() + 1, out.size(), (LabelPath) labelAndScore[i], score, 1f - score));
        }
        return out;
    }

    @Test
    @DisplayName("No neighbours yields an unclassified prediction")
    void emptyNeighbours() {
        final Prediction prediction = classifier.classify("q", List.of(), VotingConfig.vote(WeightingScheme.COUNT));

        assertThat(prediction.isClassified()).isFalse();
        assertThat(prediction.labelAsString()).isEqualTo(Prediction.UNCLASSIFIED);
    }

    @Test
    @DisplayName("Best match takes the top neighbour and its score")
    void bestMatch() {
        final Prediction prediction = classifier.classify("q",
                neighbors(EDUCATION, 0.9f, BASKETBALL, 0.8f, BASKETBALL, 0.7f), VotingConfig.bestMatch());

        assertThat(prediction.labelPath()).isEqualTo(EDUCATION);
        assertThat(prediction.confidence()).isCloseTo(0.9, within(1e-6));
    }

    @Test
    @DisplayName("Count voting picks the majority; confidence is its share")
    void countVote() {
        final Prediction prediction = classifier.classify("q",
                neighbors(EDUCATION, 0.9f, BASKETBALL, 0.8f, BASKETBALL, 0.7f, BASKETBALL, 0.6f, EDUCATION, 0.5f),
                VotingConfig.vote(WeightingScheme.COUNT));

        assertThat(prediction.labelPath()).isEqualTo(BASKETBALL);
        assertThat(prediction.confidence()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    @DisplayName("Similarity voting sums scores")
    void similarityVote() {
        final Prediction prediction = classifier.classify("q",
                neighbors(EDUCATION, 0.9f, BASKETBALL, 0.5f, BASKETBALL, 0.5f),
                VotingConfig.vote(WeightingScheme.SIMILARITY));

        assertThat(prediction.labelPath()).isEqualTo(BASKETBALL);
        assertThat(prediction.confidence()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("Inverse-distance voting favours very close neighbours")
    void inverseDistanceVote() {
        final Prediction prediction = classifier.classify("q",
                neighbors(EDUCATION, 0.99f, BASKETBALL, 0.5f, BASKETBALL, 0.5f),
                VotingConfig.vote(WeightingScheme.INVERSE_DISTANCE));

        // 1/0.01 = 100 beats 2 * 1/0.5 = 4
        assertThat(prediction.labelPath()).isEqualTo(EDUCATION);
    }

    @Test
    @DisplayName("Grouping depth merges siblings under their parent")
    void groupingDepth() {
        final List<Neighbor> list = neighbors(EDUCATION, 0.95f, BASKETBALL, 0.9f, FOOTBALL, 0.8f);

        final Prediction full = classifier.classify("q", list, VotingConfig.vote(WeightingScheme.SIMILARITY));
        final Prediction root = classifier.classify("q", list,
                VotingConfig.vote(WeightingScheme.SIMILARITY).withGroupingDepth(1));

        assertThat(full.labelPath()).isEqualTo(EDUCATION);
        assertThat(root.labelPath()).isEqualTo(LabelPath.of("体育"));
        assertThat(root.confidence()).isCloseTo(1.7, within(1e-6));
    }

    @Test
    @DisplayName("At depth 2 a parent label and its leaf vote as separate groups")
    void parentAndLeafStaySeparate() {
        final LabelPath sports = LabelPath.of("体育");
        final List<Neighbor> neighbours = neighbors(BASKETBALL, 0.9f, sports, 0.6f, sports, 0.5f);

        final Prediction leafDepth = classifier.classify("q", neighbours,
                VotingConfig.vote(WeightingScheme.SIMILARITY).withGroupingDepth(2));
        final Prediction rootDepth = classifier.classify("q", neighbours,
                VotingConfig.vote(WeightingScheme.SIMILARITY).withGroupingDepth(1));

        assertThat(leafDepth.labelPath()).isEqualTo(sports);
        assertThat(leafDepth.confidence()).isCloseTo(1.1, within(1e-6));
        assertThat(rootDepth.labelPath()).isEqualTo(sports);
        assertThat(rootDepth.confidence()).isCloseTo(2.0, within(1e-6));
    }

    @Test
    @DisplayName("Rank decay shifts weight towards the top ranks")
    void rankDecay() {
        final List<Neighbor> list = neighbors(EDUCATION, 0.5f, BASKETBALL, 0.5f, BASKETBALL, 0.5f);
        final VotingConfig vote = VotingConfig.vote(WeightingScheme.SIMILARITY);

        assertThat(classifier.classify("q", list, vote).labelPath()).isEqualTo(BASKETBALL);
        assertThat(classifier.classify("q", list, vote.withRankDecay(0.4)).labelPath()).isEqualTo(EDUCATION);
    }

    @Test
    @DisplayName("Equal weights: the group holding the highest single score wins")
    void tieBrokenByTopScore() {
        final Prediction prediction = classifier.classify("q",
                neighbors(EDUCATION, 0.5f, EDUCATION, 0.5f, BASKETBALL, 0.75f, BASKETBALL, 0.25f),
                VotingConfig.vote(WeightingScheme.SIMILARITY));

        assertThat(prediction.labelPath()).isEqualTo(BASKETBALL);
    }

    @Test
    @DisplayName("Equal weights and top scores: the deeper label wins")
    void tieBrokenByDepth() {
        final Prediction prediction = classifier.classify("q",
                neighbors(LabelPath.of("体育"), 0.8f, BASKETBALL, 0.8f),
                VotingConfig.vote(WeightingScheme.COUNT));

        assertThat(prediction.labelPath()).isEqualTo(BASKETBALL);
    }

    @Test
    @DisplayName("Full ties fall back to lexicographic order, whatever the input order")
    void tieBrokenLexicographically() {
        final List<Neighbor> list = neighbors(LabelPath.of("b"), 0.8f, LabelPath.of("a"), 0.8f);
        final List<Neighbor> reversed = new ArrayList<>(list);
        Collections.reverse(reversed);

        final VotingConfig config = VotingConfig.vote(WeightingScheme.COUNT);
        assertThat(classifier.classify("q", list, config).labelPath()).isEqualTo(LabelPath.of("a"));
        assertThat(classifier.classify("q", reversed, config).labelPath()).isEqualTo(LabelPath.of("a"));
    }

    @Test
    @DisplayName("Confidence below the threshold abstains")
    void threshold() {
        final List<Neighbor> list = neighbors(BASKETBALL, 0.4f);

        assertThat(classifier.classify("q", list, VotingConfig.bestMatch().withMinConfidence(0.5)).isClassified())
                .isFalse();
        assertThat(classifier.classify("q", list, VotingConfig.bestMatch().withMinConfidence(0.3)).labelPath())
                .isEqualTo(BASKETBALL);
    }

    @Test
    @DisplayName("The same neighbours always give the same prediction")
    void deterministic() {
        final List<Neighbor> list = neighbors(EDUCATION, 0.7f, BASKETBALL, 0.7f, FOOTBALL, 0.7f, EDUCATION, 0.1f);
        final VotingConfig config = VotingConfig.vote(WeightingScheme.SIMILARITY).withRankDecay(0.9);

        final Prediction first = classifier.classify("q", list, config);
        for (int i = 0; i < 10; i++) {
            assertThat(classifier.classify("q", list, config)).isEqualTo(first);
        }
    }
}
