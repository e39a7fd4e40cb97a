package eu.virtualparadox.labelrecall.eval.model;

import java.util.Map;
import java.util.TreeMap;

/**
 * Metrics of one evaluation run.
 *
 * @param total           evaluated examples
 * @param unclassified    examples the classifier abstained on
 * @param recallAtK       fraction of examples with the gold label among the top {@code recallK} neighbours
 * @param accuracy        fraction of predictions matching gold at {@code comparisonDepth}
 * @param recallK         K used for {@code recallAtK}
 * @param comparisonDepth label levels compared for accuracy, {@code 0} for the full path
 * @param recallAtCutoffs recall at every configured cutoff up to {@code recallK}, ascending
 * @param levelAccuracy   accuracy when comparing the first {@code d} levels, for {@code d = 1..} deepest gold label
 */
public record EvaluationReport(int total,
                               int unclassified,
                               double recallAtK,
                               double accuracy,
                               int recallK,
                               int comparisonDepth,
                               Map<Integer, Double> recallAtCutoffs,
                               Map<Integer, Double> levelAccuracy) {

    public EvaluationReport {
        recallAtCutoffs = Map.copyOf(recallAtCutoffs);
        levelAccuracy = Map.copyOf(levelAccuracy);
    }

    public static EvaluationReport empty(final int recallK, final int comparisonDepth) {
        return new EvaluationReport(0, 0, 0.0, 0.0, recallK, comparisonDepth, Map.of(), Map.of());
    }

    public String asString() {
        return String.format("examples=%d, unclassified=%d, recall@%d=%.4f, accuracy=%.4f (depth %s), "
                        + "recall@cutoffs=%s, level accuracy=%s",
                total, unclassified, recallK, recallAtK, accuracy,
                comparisonDepth <= 0 ? "full" : String.valueOf(comparisonDepth),
                new TreeMap<>(recallAtCutoffs), new TreeMap<>(levelAccuracy));
    }
}
