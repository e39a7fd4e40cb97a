package eu.virtualparadox.labelrecall.train;

import eu.virtualparadox.labelrecall.ingest.model.TrainingPair;
import eu.virtualparadox.labelrecall.rag.embed.SparseGradient;
import eu.virtualparadox.labelrecall.rag.embed.TrainableEncoder;
import eu.virtualparadox.labelrecall.train.model.StepResult;
import eu.virtualparadox.labelrecall.train.model.StepStatus;
import eu.virtualparadox.labelrecall.train.model.TrainingConfig;
import eu.virtualparadox.labelrecall.util.VectorMath;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Trains a {@link TrainableEncoder} with in-batch negatives.
 * <p>
 * One step encodes the queries and positives of a batch with the same encoder, scores
 * every query against every positive with {@link InBatchNegativeLoss}, back-propagates
 * through the encoder and applies one SGD update. In {@link SimilarityMode#COSINE} mode
 * the embeddings are L2-normalized inside the step, so the loss sees cosine similarities
 * whatever the encoder emits.
 * <p>
 * A step whose loss or gradient is not finite leaves the weights untouched. After
 * {@link TrainingConfig#maxConsecutiveNumericFailures()} such steps in a row the trainer
 * reports itself degraded; it keeps accepting steps so the caller decides whether to stop.
 * <p>
 * Steps are not reentrant: drive one trainer from one thread. Parallelism lives inside
 * {@link #trainParallelStep(List, float)}.
 */
@Slf4j
public class ContrastiveTrainer {

    private final TrainableEncoder encoder;
    private final TrainingConfig config;
    private final Executor executor;

    private int consecutiveNumericFailures;
    private boolean degraded;

    /**
     * @param executor runs the shards of a parallel step; plain steps run on the caller's thread
     */
    public ContrastiveTrainer(final TrainableEncoder encoder, final TrainingConfig config, final Executor executor) {
        this.encoder = encoder;
        this.config = config;
        this.executor = executor;
    }

    /**
     * Runs one step on a batch of pairs.
     */
    public StepResult trainStep(final List<TrainingPair> batch, final float margin) {
        return trainStep(queriesOf(batch), positivesOf(batch), margin);
    }

    /**
     * Runs one step on aligned query and positive texts.
     *
     * @throws IllegalArgumentException if the two lists differ in size
     */
    public StepResult trainStep(final List<String> queries, final List<String> positives, final float margin) {
        requireAligned(queries, positives);
        final int size = queries.size();
        if (size == 0) {
            return StepResult.skipped(StepStatus.SKIPPED_EMPTY, 0);
        }
        if (size == 1) {
            log.warn("Skipping training step with a single pair: no in-batch negatives");
            return StepResult.skipped(StepStatus.SKIPPED_NO_NEGATIVES, 1);
        }

        final ShardOutcome outcome = computeShard(queries, positives, margin);
        if (!outcome.isFinite()) {
            return numericFailure(outcome.loss, size);
        }
        encoder.apply(outcome.gradient, config.learningRate());
        consecutiveNumericFailures = 0;
        return new StepResult(outcome.loss, StepStatus.APPLIED, size);
    }

    /**
     * Data-parallel step: every shard computes its loss and gradient on the executor
     * against the same weights, the gradients are averaged and applied once.
     * <p>
     * In-batch negatives come from the shard itself. Shards with fewer than two pairs
     * contribute nothing.
     */
    public StepResult trainParallelStep(final List<List<TrainingPair>> shards, final float margin) {
        final List<List<TrainingPair>> usable = new ArrayList<>();
        int total = 0;
        for (final List<TrainingPair> shard : shards) {
            total += shard.size();
            if (shard.size() >= 2) {
                usable.add(shard);
            }
        }
        if (total == 0) {
            return StepResult.skipped(StepStatus.SKIPPED_EMPTY, 0);
        }
        if (usable.isEmpty()) {
            log.warn("Skipping parallel step: no shard holds two or more pairs");
            return StepResult.skipped(StepStatus.SKIPPED_NO_NEGATIVES, total);
        }

        final List<CompletableFuture<ShardOutcome>> futures = new ArrayList<>(usable.size());
        for (final List<TrainingPair> shard : usable) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> computeShard(queriesOf(shard), positivesOf(shard), margin), executor));
        }

        final SparseGradient merged = encoder.newGradient();
        double lossSum = 0.0;
        boolean finite = true;
        for (final CompletableFuture<ShardOutcome> future : futures) {
            final ShardOutcome outcome = join(future);
            lossSum += outcome.loss;
            finite &= outcome.isFinite();
            if (finite) {
                merged.merge(outcome.gradient);
            }
        }
        final double loss = lossSum / usable.size();
        if (!finite) {
            return numericFailure(loss, total);
        }

        merged.scale(1.0f / usable.size());
        encoder.apply(merged, config.learningRate());
        consecutiveNumericFailures = 0;
        return new StepResult(loss, StepStatus.APPLIED, total);
    }

    /**
     * Computes the batch loss with the current weights without updating them.
     */
    public double computeLoss(final List<String> queries, final List<String> positives, final float margin) {
        requireAligned(queries, positives);
        final float[][] q = embed(queries);
        final float[][] p = embed(positives);
        return lossFunction(margin).loss(q, p);
    }

    public boolean isDegraded() {
        return degraded;
    }

    public int consecutiveNumericFailures() {
        return consecutiveNumericFailures;
    }

    private ShardOutcome computeShard(final List<String> queries, final List<String> positives, final float margin) {
        final int n = queries.size();
        final TrainableEncoder.ForwardPass[] queryPasses = new TrainableEncoder.ForwardPass[n];
        final TrainableEncoder.ForwardPass[] positivePasses = new TrainableEncoder.ForwardPass[n];
        final float[][] q = new float[n][];
        final float[][] p = new float[n][];
        for (int i = 0; i < n; i++) {
            queryPasses[i] = encoder.forward(queries.get(i));
            positivePasses[i] = encoder.forward(positives.get(i));
            q[i] = project(queryPasses[i].output());
            p[i] = project(positivePasses[i].output());
        }

        final InBatchNegativeLoss.Result result = lossFunction(margin).lossAndGradients(q, p);
        final SparseGradient gradient = encoder.newGradient();
        if (!Double.isFinite(result.loss())) {
            return new ShardOutcome(result.loss(), gradient, false);
        }

        for (int i = 0; i < n; i++) {
            encoder.backward(queryPasses[i], unproject(queryPasses[i].output(), q[i], result.dQueries()[i]), gradient);
            encoder.backward(positivePasses[i], unproject(positivePasses[i].output(), p[i], result.dPositives()[i]), gradient);
        }
        return new ShardOutcome(result.loss(), gradient, gradient.isFinite());
    }

    private float[][] embed(final List<String> texts) {
        final float[][] out = new float[texts.size()][];
        for (int i = 0; i < out.length; i++) {
            out[i] = project(encoder.encode(texts.get(i)));
        }
        return out;
    }

    private float[] project(final float[] output) {
        return config.similarity() == SimilarityMode.COSINE ? VectorMath.normalize(output) : output;
    }

    private float[] unproject(final float[] output, final float[] projected, final float[] gradient) {
        return config.similarity() == SimilarityMode.COSINE
                ? VectorMath.normalizeBackward(output, projected, gradient)
                : gradient;
    }

    private InBatchNegativeLoss lossFunction(final float margin) {
        return new InBatchNegativeLoss(margin, config.effectiveScale(), config.symmetric());
    }

    private StepResult numericFailure(final double loss, final int size) {
        consecutiveNumericFailures++;
        log.warn("Skipping training step: non-finite loss or gradient (loss={}, {} in a row)",
                loss, consecutiveNumericFailures);
        if (!degraded && consecutiveNumericFailures >= config.maxConsecutiveNumericFailures()) {
            degraded = true;
            log.error("Training degraded: {} consecutive numeric failures", consecutiveNumericFailures);
        }
        return new StepResult(loss, StepStatus.SKIPPED_NUMERIC, size);
    }

    private static ShardOutcome join(final CompletableFuture<ShardOutcome> future) {
        try {
            return future.join();
        } catch (final CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Training shard failed", e.getCause());
        }
    }

    private static void requireAligned(final List<String> queries, final List<String> positives) {
        if (queries.size() != positives.size()) {
            throw new IllegalArgumentException(
                    "Query count " + queries.size() + " != positive count " + positives.size());
        }
    }

    private static List<String> queriesOf(final List<TrainingPair> batch) {
        return batch.stream().map(TrainingPair::query).toList();
    }

    private static List<String> positivesOf(final List<TrainingPair> batch) {
        return batch.stream().map(TrainingPair::positive).toList();
    }

    private record ShardOutcome(double loss, SparseGradient gradient, boolean finite) {

        boolean isFinite() {
            return finite && Double.isFinite(loss);
        }
    }
}
