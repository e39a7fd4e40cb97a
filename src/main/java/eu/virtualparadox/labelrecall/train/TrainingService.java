package eu.virtualparadox.labelrecall.train;

import eu.virtualparadox.labelrecall.application.config.ApplicationConfig;
import eu.virtualparadox.labelrecall.application.executor.TrainingExecutor;
import eu.virtualparadox.labelrecall.ingest.model.TrainingPair;
import eu.virtualparadox.labelrecall.rag.embed.TextEncoder;
import eu.virtualparadox.labelrecall.rag.embed.TrainableEncoder;
import eu.virtualparadox.labelrecall.train.model.StepResult;
import eu.virtualparadox.labelrecall.train.model.StepStatus;
import eu.virtualparadox.labelrecall.train.model.TrainingConfig;
import eu.virtualparadox.labelrecall.train.model.TrainingReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Runs contrastive training epochs over the shared encoder.
 * <p>
 * Each epoch shuffles the pairs with a seeded {@link Random}, cuts them into batches of
 * {@code batchSize} and runs one step per batch. With {@code workers > 1} every batch is
 * split into that many shards and trained as one data-parallel step.
 * <p>
 * {@link #cancel()} takes effect between steps; the step in flight always completes, so
 * the weights are never left half-updated. Each request is consumed by exactly one run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingService {

    private final TextEncoder encoder;
    private final ApplicationConfig applicationConfig;
    private final TrainingExecutor trainingExecutor;

    private volatile boolean cancelRequested;

    /**
     * Trains with the configured hyper-parameters.
     */
    public TrainingReport train(final List<TrainingPair> pairs) {
        return train(pairs, applicationConfig.getTraining().toTrainingConfig());
    }

    /**
     * Trains with explicit hyper-parameters.
     *
     * @return the run summary; {@link TrainingReport#notRun()} when the encoder is frozen
     */
    public TrainingReport train(final List<TrainingPair> pairs, final TrainingConfig config) {
        if (!(encoder instanceof TrainableEncoder trainable)) {
            log.warn("Encoder {} is not trainable, skipping training", encoder.name());
            return TrainingReport.notRun();
        }
        try {
            return runEpochs(trainable, pairs, config);
        } finally {
            // a cancel() issued before or during this run is consumed by it
            cancelRequested = false;
        }
    }

    private TrainingReport runEpochs(final TrainableEncoder trainable,
                                     final List<TrainingPair> pairs,
                                     final TrainingConfig config) {
        final ContrastiveTrainer trainer = new ContrastiveTrainer(trainable, config, trainingExecutor);
        final List<TrainingPair> order = new ArrayList<>(pairs);
        final Random random = new Random(config.seed());
        final List<Double> epochLosses = new ArrayList<>();

        int applied = 0;
        int skipped = 0;
        int numeric = 0;
        boolean cancelled = false;

        log.info("Training {} on {} pairs: epochs={}, batch={}, lr={}, margin={}, similarity={}, workers={}",
                encoder.name(), pairs.size(), config.epochs(), config.batchSize(), config.learningRate(),
                config.margin(), config.similarity(), config.workers());

        epochs:
        for (int epoch = 1; epoch <= config.epochs(); epoch++) {
            Collections.shuffle(order, random);
            double lossSum = 0.0;
            int lossSteps = 0;

            for (int from = 0; from < order.size(); from += config.batchSize()) {
                if (cancelRequested) {
                    log.info("Training cancelled during epoch {}", epoch);
                    cancelled = true;
                    break epochs;
                }
                final List<TrainingPair> batch = order.subList(from, Math.min(order.size(), from + config.batchSize()));
                final StepResult step = config.workers() > 1
                        ? trainer.trainParallelStep(shard(batch, config.workers()), config.margin())
                        : trainer.trainStep(batch, config.margin());

                if (step.isApplied()) {
                    applied++;
                    lossSum += step.loss();
                    lossSteps++;
                } else {
                    skipped++;
                    if (step.status() == StepStatus.SKIPPED_NUMERIC) {
                        numeric++;
                    }
                }
            }

            final double epochLoss = lossSteps == 0 ? Double.NaN : lossSum / lossSteps;
            epochLosses.add(epochLoss);
            log.info("Epoch {}/{} finished: mean loss {} over {} applied steps", epoch, config.epochs(),
                    String.format("%.4f", epochLoss), lossSteps);
        }

        final TrainingReport report = new TrainingReport(epochLosses.size(), applied, skipped, numeric,
                epochLosses, trainer.isDegraded(), cancelled);
        if (report.degraded()) {
            log.error("Training finished in degraded state: {} numeric failures", numeric);
        } else {
            log.info("Training finished: {} applied, {} skipped steps", applied, skipped);
        }
        return report;
    }

    /**
     * Requests cancellation; the running step finishes first. A request made while no
     * run is active stops the next run before its first step.
     */
    public void cancel() {
        cancelRequested = true;
    }

    static List<List<TrainingPair>> shard(final List<TrainingPair> batch, final int shards) {
        final List<List<TrainingPair>> out = new ArrayList<>(shards);
        final int size = (int) Math.ceil(batch.size() / (double) shards);
        for (int from = 0; from < batch.size(); from += size) {
            out.add(batch.subList(from, Math.min(batch.size(), from + size)));
        }
        return out;
    }
}
