package eu.virtualparadox.labelrecall.classify.model;

public enum VotingStrategy {
    /** Label of the single top-ranked neighbour. */
    BEST_MATCH,
    /** Weighted vote over neighbour groups. */
    VOTE
}
