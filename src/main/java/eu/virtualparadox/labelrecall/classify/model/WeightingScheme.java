package eu.virtualparadox.labelrecall.classify.model;

/**
 * How much a neighbour contributes to its label group in a {@link VotingStrategy#VOTE}.
 */
public enum WeightingScheme {
    /** Each neighbour counts once; group weight is the fraction of neighbours in the group. */
    COUNT,
    /** Group weight is the sum of neighbour similarity scores. */
    SIMILARITY,
    /** Group weight is the sum of {@code 1 / (distance + epsilon)}. */
    INVERSE_DISTANCE
}
