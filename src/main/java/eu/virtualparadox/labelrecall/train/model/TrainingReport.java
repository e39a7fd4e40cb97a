package eu.virtualparadox.labelrecall.train.model;

import java.util.List;

/**
 * Summary of a training run.
 *
 * @param epochsCompleted epochs that ran to the end
 * @param appliedSteps    steps whose update reached the weights
 * @param skippedSteps    steps skipped (empty, no negatives, numeric)
 * @param numericFailures steps skipped because of NaN/Inf
 * @param epochLosses     mean loss of the applied steps of each completed epoch
 * @param degraded        {@code true} when too many consecutive steps failed numerically
 * @param cancelled       {@code true} when {@code cancel()} stopped the run between steps
 */
public record TrainingReport(int epochsCompleted,
                             int appliedSteps,
                             int skippedSteps,
                             int numericFailures,
                             List<Double> epochLosses,
                             boolean degraded,
                             boolean cancelled) {

    public TrainingReport {
        epochLosses = List.copyOf(epochLosses);
    }

    /**
     * Report of a run that never started (e.g. the encoder is frozen).
     */
    public static TrainingReport notRun() {
        return new TrainingReport(0, 0, 0, 0, List.of(), false, false);
    }

    public double finalLoss() {
        return epochLosses.isEmpty() ? Double.NaN : epochLosses.get(epochLosses.size() - 1);
    }
}
