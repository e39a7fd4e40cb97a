package eu.virtualparadox.labelrecall.query;

import eu.virtualparadox.labelrecall.application.config.ApplicationConfig;
import eu.virtualparadox.labelrecall.application.executor.QueryExecutor;
import eu.virtualparadox.labelrecall.classify.VotingClassifier;
import eu.virtualparadox.labelrecall.classify.model.Prediction;
import eu.virtualparadox.labelrecall.classify.model.VotingConfig;
import eu.virtualparadox.labelrecall.ingest.cleaner.TextCleaner;
import eu.virtualparadox.labelrecall.rag.index.ActiveIndexRegistry;
import eu.virtualparadox.labelrecall.rag.index.IndexLease;
import eu.virtualparadox.labelrecall.rag.index.VectorIndex;
import eu.virtualparadox.labelrecall.rag.retriever.RecallEngine;
import eu.virtualparadox.labelrecall.rag.retriever.model.QueryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for inference: cleans the text, recalls neighbours from the active index
 * and votes a label.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ClassificationManager {

    private final RecallEngine recallEngine;
    private final VotingClassifier votingClassifier;
    private final ActiveIndexRegistry registry;
    private final QueryExecutor queryExecutor;
    private final TextCleaner textCleaner;
    private final ApplicationConfig applicationConfig;

    private final AtomicLong queryIds = new AtomicLong();

    public Prediction classify(final String text) {
        return classify(nextQueryId(), textCleaner.cleanText(text));
    }

    public QueryResult recall(final String text) {
        return recallEngine.recall(nextQueryId(), textCleaner.cleanText(text),
                applicationConfig.getVoting().getTopK());
    }

    /**
     * Classifies many texts concurrently against one snapshot of the active index.
     *
     * @throws IllegalStateException if no index has been activated
     */
    public BatchReport predictBatch(final List<String> texts) {
        final int topK = applicationConfig.getVoting().getTopK();
        final VotingConfig votingConfig = applicationConfig.getVoting().toVotingConfig();

        try (IndexLease lease = registry.acquire()) {
            if (!lease.isPresent()) {
                throw new IllegalStateException("No active index: build one before predicting");
            }
            final VectorIndex index = lease.index();

            final List<String> cleaned = texts.stream().map(textCleaner::cleanText).toList();
            final List<CompletableFuture<QueryResult>> futures = new ArrayList<>(cleaned.size());
            for (final String text : cleaned) {
                final String queryId = nextQueryId();
                futures.add(CompletableFuture.supplyAsync(
                        () -> recallEngine.recall(queryId, text, topK, index), queryExecutor));
            }

            final List<QueryResult> recalls = new ArrayList<>(futures.size());
            final List<Prediction> predictions = new ArrayList<>(futures.size());
            int unclassified = 0;
            int timedOut = 0;
            for (final CompletableFuture<QueryResult> future : futures) {
                final QueryResult result = join(future);
                final Prediction prediction = votingClassifier.classify(result.queryId(), result.neighbors(),
                        votingConfig);
                recalls.add(result);
                predictions.add(prediction);
                if (!prediction.isClassified()) {
                    unclassified++;
                }
                if (!result.complete()) {
                    timedOut++;
                }
            }

            log.info("Predicted {} texts: {} unclassified, {} timed out", predictions.size(), unclassified, timedOut);
            return new BatchReport(cleaned, predictions, recalls, unclassified, timedOut);
        }
    }

    private Prediction classify(final String queryId, final String text) {
        final QueryResult result = recallEngine.recall(queryId, text, applicationConfig.getVoting().getTopK());
        final Prediction prediction = votingClassifier.classify(queryId, result.neighbors(),
                applicationConfig.getVoting().toVotingConfig());
        log.debug("Query {} classified as {} ({})", queryId, prediction.labelAsString(), prediction.confidence());
        return prediction;
    }

    private String nextQueryId() {
        return "q-" + queryIds.incrementAndGet();
    }

    private static QueryResult join(final CompletableFuture<QueryResult> future) {
        try {
            return future.join();
        } catch (final CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Prediction query failed", e.getCause());
        }
    }
}
