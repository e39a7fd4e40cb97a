package eu.virtualparadox.labelrecall.eval;

import eu.virtualparadox.labelrecall.application.config.ApplicationConfig;
import eu.virtualparadox.labelrecall.application.executor.QueryExecutor;
import eu.virtualparadox.labelrecall.classify.VotingClassifier;
import eu.virtualparadox.labelrecall.classify.model.Prediction;
import eu.virtualparadox.labelrecall.classify.model.VotingConfig;
import eu.virtualparadox.labelrecall.eval.model.EvaluationReport;
import eu.virtualparadox.labelrecall.ingest.model.Example;
import eu.virtualparadox.labelrecall.label.LabelPath;
import eu.virtualparadox.labelrecall.label.LabelPaths;
import eu.virtualparadox.labelrecall.rag.index.ActiveIndexRegistry;
import eu.virtualparadox.labelrecall.rag.index.IndexLease;
import eu.virtualparadox.labelrecall.rag.index.VectorIndex;
import eu.virtualparadox.labelrecall.rag.retriever.RecallEngine;
import eu.virtualparadox.labelrecall.rag.retriever.model.Neighbor;
import eu.virtualparadox.labelrecall.rag.retriever.model.QueryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Measures retrieval and classification quality against held-out labeled examples.
 * <p>
 * Every example is recalled once with {@code max(recallK, topK)} neighbours on the
 * {@link QueryExecutor}; recall metrics look at that list, the classifier votes over its
 * first {@code topK} entries.
 * <ul>
 *   <li>recall@K: gold label (full path) present among the first K neighbours</li>
 *   <li>accuracy: prediction matches gold at {@code comparisonDepth}; abstentions count as misses</li>
 * </ul>
 * Both metrics compare labels only through {@link LabelPaths#matches(LabelPath, LabelPath, int)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Evaluator {

    private final RecallEngine recallEngine;
    private final VotingClassifier votingClassifier;
    private final ActiveIndexRegistry registry;
    private final QueryExecutor queryExecutor;
    private final ApplicationConfig applicationConfig;

    /**
     * Evaluates against the active index with the configured settings.
     */
    public EvaluationReport evaluate(final List<Example> golden) {
        final ApplicationConfig.Evaluation settings = applicationConfig.getEvaluation();
        return evaluate(golden, settings.getRecallK(), applicationConfig.getVoting().toVotingConfig(),
                settings.getComparisonDepth());
    }

    /**
     * Evaluates against the active index.
     *
     * @throws IllegalStateException if no index has been activated
     */
    public EvaluationReport evaluate(final List<Example> golden,
                                     final int recallK,
                                     final VotingConfig votingConfig,
                                     final int comparisonDepth) {
        try (IndexLease lease = registry.acquire()) {
            if (!lease.isPresent()) {
                throw new IllegalStateException("No active index: build one before evaluating");
            }
            return evaluate(golden, lease.index(), recallK, applicationConfig.getVoting().getTopK(),
                    votingConfig, comparisonDepth);
        }
    }

    /**
     * Evaluates against an explicit index.
     *
     * @param recallK maximum rank counted by recall@K
     * @param topK    neighbours handed to the classifier
     */
    public EvaluationReport evaluate(final List<Example> golden,
                                     final VectorIndex index,
                                     final int recallK,
                                     final int topK,
                                     final VotingConfig votingConfig,
                                     final int comparisonDepth) {
        requirePositive(recallK, topK);
        if (golden.isEmpty()) {
            log.warn("Evaluation set is empty");
            return EvaluationReport.empty(recallK, comparisonDepth);
        }
        final long start = System.nanoTime();
        final int searchK = Math.max(recallK, topK);

        final List<CompletableFuture<QueryResult>> futures = new ArrayList<>(golden.size());
        for (int i = 0; i < golden.size(); i++) {
            final String queryId = "eval-" + (i + 1);
            final String text = golden.get(i).text();
            futures.add(CompletableFuture.supplyAsync(
                    () -> recallEngine.recall(queryId, text, searchK, index), queryExecutor));
        }

        final List<QueryResult> results = new ArrayList<>(golden.size());
        final List<Prediction> predictions = new ArrayList<>(golden.size());
        for (final CompletableFuture<QueryResult> future : futures) {
            final QueryResult result = join(future);
            results.add(result);
            final List<Neighbor> voters = result.neighbors().subList(0, Math.min(topK, result.neighbors().size()));
            predictions.add(votingClassifier.classify(result.queryId(), voters, votingConfig));
        }

        final EvaluationReport report = evaluateResults(golden, results, predictions, recallK, comparisonDepth,
                applicationConfig.getEvaluation().getCutoffs());
        log.info("Evaluation finished in {} ms: {}", (System.nanoTime() - start) / 1_000_000, report.asString());
        return report;
    }

    /**
     * Computes the metrics from already recalled neighbours and predictions, aligned by position.
     */
    public EvaluationReport evaluateResults(final List<Example> golden,
                                            final List<QueryResult> results,
                                            final List<Prediction> predictions,
                                            final int recallK,
                                            final int comparisonDepth,
                                            final List<Integer> cutoffs) {
        if (golden.size() != results.size() || golden.size() != predictions.size()) {
            throw new IllegalArgumentException("golden, results and predictions must be aligned");
        }
        requirePositive(recallK, 1);
        final int total = golden.size();
        if (total == 0) {
            return EvaluationReport.empty(recallK, comparisonDepth);
        }

        final TreeSet<Integer> allCutoffs = new TreeSet<>();
        for (final Integer cutoff : cutoffs) {
            if (cutoff != null && cutoff > 0 && cutoff <= recallK) {
                allCutoffs.add(cutoff);
            }
        }
        allCutoffs.add(recallK);

        int maxDepth = 0;
        for (final Example example : golden) {
            maxDepth = Math.max(maxDepth, example.labelPath().depth());
        }

        final Map<Integer, Integer> hitsAtCutoff = new HashMap<>();
        final int[] levelHits = new int[maxDepth + 1];
        int correct = 0;
        int unclassified = 0;

        for (int i = 0; i < total; i++) {
            final LabelPath gold = golden.get(i).labelPath();

            final int firstHit = firstRankOf(gold, results.get(i).neighbors());
            for (final int cutoff : allCutoffs) {
                if (firstHit > 0 && firstHit <= cutoff) {
                    hitsAtCutoff.merge(cutoff, 1, Integer::sum);
                }
            }

            final Prediction prediction = predictions.get(i);
            if (!prediction.isClassified()) {
                unclassified++;
                continue;
            }
            if (LabelPaths.matches(prediction.labelPath(), gold, comparisonDepth)) {
                correct++;
            }
            for (int depth = 1; depth <= maxDepth; depth++) {
                if (LabelPaths.matches(prediction.labelPath(), gold, depth)) {
                    levelHits[depth]++;
                }
            }
        }

        final Map<Integer, Double> recallAtCutoffs = new HashMap<>();
        for (final int cutoff : allCutoffs) {
            recallAtCutoffs.put(cutoff, hitsAtCutoff.getOrDefault(cutoff, 0) / (double) total);
        }
        final Map<Integer, Double> levelAccuracy = new HashMap<>();
        for (int depth = 1; depth <= maxDepth; depth++) {
            levelAccuracy.put(depth, levelHits[depth] / (double) total);
        }

        return new EvaluationReport(total, unclassified, recallAtCutoffs.get(recallK), correct / (double) total,
                recallK, comparisonDepth, recallAtCutoffs, levelAccuracy);
    }

    /**
     * @return 1-based rank of the first neighbour whose full label equals {@code gold}, {@code 0} if none
     */
    private static int firstRankOf(final LabelPath gold, final List<Neighbor> neighbors) {
        for (int i = 0; i < neighbors.size(); i++) {
            if (LabelPaths.matches(neighbors.get(i).labelPath(), gold, LabelPaths.FULL_DEPTH)) {
                return i + 1;
            }
        }
        return 0;
    }

    private static void requirePositive(final int recallK, final int topK) {
        if (recallK < 1 || topK < 1) {
            throw new IllegalArgumentException("recallK and topK must be >= 1, got " + recallK + " and " + topK);
        }
    }

    private static QueryResult join(final CompletableFuture<QueryResult> future) {
        try {
            return future.join();
        } catch (final CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Evaluation query failed", e.getCause());
        }
    }
}
