package eu.virtualparadox.labelrecall.classify.model;

import java.util.Objects;

/**
 * Aggregation policy of the voting classifier.
 *
 * @param strategy      best match or weighted vote
 * @param weighting     neighbour weight in a vote
 * @param groupingDepth number of label levels neighbours are grouped by, {@code 0} for the full path
 * @param rankDecay     per-rank weight multiplier in {@code (0, 1]}; the neighbour at 0-based rank r
 *                      contributes {@code rankDecay^r} times its weight ({@code 1} disables decay)
 * @param minConfidence predictions whose confidence falls below this value are unclassified
 */
public record VotingConfig(VotingStrategy strategy,
                           WeightingScheme weighting,
                           int groupingDepth,
                           double rankDecay,
                           double minConfidence) {

    public VotingConfig {
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(weighting, "weighting must not be null");
        if (groupingDepth < 0) {
            throw new IllegalArgumentException("groupingDepth must be >= 0");
        }
        if (!(rankDecay > 0.0 && rankDecay <= 1.0)) {
            throw new IllegalArgumentException("rankDecay must be in (0, 1], got " + rankDecay);
        }
        if (Double.isNaN(minConfidence)) {
            throw new IllegalArgumentException("minConfidence must be a number");
        }
    }

    public static VotingConfig bestMatch() {
        return new VotingConfig(VotingStrategy.BEST_MATCH, WeightingScheme.SIMILARITY, 0, 1.0, Double.NEGATIVE_INFINITY);
    }

    public static VotingConfig vote(final WeightingScheme weighting) {
        return new VotingConfig(VotingStrategy.VOTE, weighting, 0, 1.0, Double.NEGATIVE_INFINITY);
    }

    public VotingConfig withMinConfidence(final double threshold) {
        return new VotingConfig(strategy, weighting, groupingDepth, rankDecay, threshold);
    }

    public VotingConfig withGroupingDepth(final int depth) {
        return new VotingConfig(strategy, weighting, depth, rankDecay, minConfidence);
    }

    public VotingConfig withRankDecay(final double decay) {
        return new VotingConfig(strategy, weighting, groupingDepth, decay, minConfidence);
    }
}
