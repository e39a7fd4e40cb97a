package eu.virtualparadox.labelrecall.train.model;

/**
 * @param loss      batch loss before the update, {@code NaN} when the step was skipped before computing it
 * @param status    what happened to the weights
 * @param batchSize number of pairs in the step (summed over shards for parallel steps)
 */
public record StepResult(double loss, StepStatus status, int batchSize) {

    public static StepResult skipped(final StepStatus status, final int batchSize) {
        return new StepResult(Double.NaN, status, batchSize);
    }

    public boolean isApplied() {
        return status.isApplied();
    }
}
