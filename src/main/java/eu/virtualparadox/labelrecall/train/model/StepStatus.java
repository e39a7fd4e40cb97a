package eu.virtualparadox.labelrecall.train.model;

/**
 * Outcome of a single training step.
 */
public enum StepStatus {

    /** Gradients were computed and applied. */
    APPLIED,

    /** The batch held no pairs. */
    SKIPPED_EMPTY,

    /** The batch held a single pair, so there were no in-batch negatives. */
    SKIPPED_NO_NEGATIVES,

    /** Loss or gradients were NaN or infinite; weights were left untouched. */
    SKIPPED_NUMERIC;

    public boolean isApplied() {
        return this == APPLIED;
    }
}
