package eu.virtualparadox.labelrecall.classify;

import eu.virtualparadox.labelrecall.classify.model.Prediction;
import eu.virtualparadox.labelrecall.classify.model.VotingConfig;
import eu.virtualparadox.labelrecall.classify.model.VotingStrategy;
import eu.virtualparadox.labelrecall.label.LabelPath;
import eu.virtualparadox.labelrecall.label.LabelPaths;
import eu.virtualparadox.labelrecall.rag.retriever.model.Neighbor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an ordered neighbour list into a single label prediction.
 *
 * <h3>Strategies</h3>
 * <ul>
 *   <li>{@link VotingStrategy#BEST_MATCH}: the first neighbour's label; confidence is its score.</li>
 *   <li>{@link VotingStrategy#VOTE}: neighbours are grouped by their label truncated to
 *       {@code groupingDepth}; each group accumulates weight according to the
 *       {@link eu.virtualparadox.labelrecall.classify.model.WeightingScheme}; the heaviest group wins
 *       and its weight is the confidence.</li>
 * </ul>
 *
 * <h3>Ties</h3>
 * Weights within {@value #TIE_EPSILON} are tied. Ties go to the group holding the single
 * highest-scoring neighbour, then to the more specific (deeper) label, then to the
 * lexicographically smaller label so the outcome never depends on iteration order.
 * <p>
 * No randomness is involved: the same neighbour list always yields the same prediction.
 */
@Slf4j
@Component
public class VotingClassifier {

    static final double TIE_EPSILON = 1e-9;
    private static final double DISTANCE_EPSILON = 1e-6;

    /**
     * Classifies one query from its recalled neighbours.
     *
     * @param queryId   query identifier carried into the prediction
     * @param neighbors neighbours ordered best first (may be empty)
     * @param config    aggregation policy
     * @return the prediction, or an unclassified prediction when there are no neighbours
     *         or the confidence is below {@code config.minConfidence()}
     */
    public Prediction classify(final String queryId, final List<Neighbor> neighbors, final VotingConfig config) {
        if (neighbors == null || neighbors.isEmpty()) {
            log.debug("Query {} has no neighbours, unclassified", queryId);
            return Prediction.unclassified(queryId);
        }

        final Prediction candidate = config.strategy() == VotingStrategy.BEST_MATCH
                ? bestMatch(queryId, neighbors.get(0))
                : vote(queryId, neighbors, config);

        if (candidate.confidence() < config.minConfidence()) {
            log.debug("Query {} best label {} has confidence {} below {}, unclassified",
                    queryId, candidate.labelAsString(), candidate.confidence(), config.minConfidence());
            return Prediction.unclassified(queryId);
        }
        return candidate;
    }

    private Prediction bestMatch(final String queryId, final Neighbor top) {
        return new Prediction(queryId, top.labelPath(), top.score());
    }

    private Prediction vote(final String queryId, final List<Neighbor> neighbors, final VotingConfig config) {
        final Map<LabelPath, Group> groups = new LinkedHashMap<>();
        double totalWeight = 0.0;

        for (int i = 0; i < neighbors.size(); i++) {
            final Neighbor n = neighbors.get(i);
            final double weight = weightOf(n, config) * Math.pow(config.rankDecay(), i);
            totalWeight += weight;
            final LabelPath key = LabelPaths.comparisonKey(n.labelPath(), config.groupingDepth());
            groups.computeIfAbsent(key, Group::new).add(weight, n.score());
        }

        Group winner = null;
        for (final Group group : groups.values()) {
            if (winner == null || group.beats(winner)) {
                winner = group;
            }
        }

        final double confidence = switch (config.weighting()) {
            case COUNT -> totalWeight > 0.0 ? winner.weight / totalWeight : 0.0;
            case SIMILARITY, INVERSE_DISTANCE -> winner.weight;
        };
        return new Prediction(queryId, winner.label, confidence);
    }

    private double weightOf(final Neighbor neighbor, final VotingConfig config) {
        return switch (config.weighting()) {
            case COUNT -> 1.0;
            case SIMILARITY -> neighbor.score();
            case INVERSE_DISTANCE -> 1.0 / (Math.max(0.0, neighbor.distance()) + DISTANCE_EPSILON);
        };
    }

    /**
     * Accumulated vote of one label group.
     */
    private static final class Group {

        private final LabelPath label;
        private double weight;
        private double topScore = Double.NEGATIVE_INFINITY;

        Group(final LabelPath label) {
            this.label = label;
        }

        void add(final double w, final double score) {
            weight += w;
            topScore = Math.max(topScore, score);
        }

        boolean beats(final Group other) {
            if (Math.abs(weight - other.weight) > TIE_EPSILON) {
                return weight > other.weight;
            }
            if (topScore != other.topScore) {
                return topScore > other.topScore;
            }
            if (label.depth() != other.label.depth()) {
                return label.depth() > other.label.depth();
            }
            return label.compareTo(other.label) < 0;
        }
    }
}
