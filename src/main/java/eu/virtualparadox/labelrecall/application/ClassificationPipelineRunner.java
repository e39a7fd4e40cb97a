package eu.virtualparadox.labelrecall.application;

import eu.virtualparadox.labelrecall.application.config.ApplicationConfig;
import eu.virtualparadox.labelrecall.eval.Evaluator;
import eu.virtualparadox.labelrecall.eval.model.EvaluationReport;
import eu.virtualparadox.labelrecall.ingest.model.Example;
import eu.virtualparadox.labelrecall.ingest.model.TrainingPair;
import eu.virtualparadox.labelrecall.ingest.parser.ParseResult;
import eu.virtualparadox.labelrecall.ingest.parser.RecordParser;
import eu.virtualparadox.labelrecall.query.BatchReport;
import eu.virtualparadox.labelrecall.query.ClassificationManager;
import eu.virtualparadox.labelrecall.query.output.ResultWriter;
import eu.virtualparadox.labelrecall.rag.index.ReindexService;
import eu.virtualparadox.labelrecall.train.TrainingService;
import eu.virtualparadox.labelrecall.train.model.TrainingReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs the offline pipeline on startup, one step per configured input file:
 * <ol>
 *     <li>train the encoder on {@code labelrecall.data.train}</li>
 *     <li>embed and index {@code labelrecall.data.corpus}</li>
 *     <li>evaluate on {@code labelrecall.data.eval}</li>
 *     <li>classify {@code labelrecall.data.predict} and write predictions and recall lists</li>
 * </ol>
 * Steps without a file are skipped. Evaluation and prediction need the corpus step.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClassificationPipelineRunner implements ApplicationRunner {

    static final String PREDICTIONS_FILE = "predictions.tsv";
    static final String RECALL_FILE = "recall.tsv";

    private final ApplicationConfig applicationConfig;
    private final RecordParser recordParser;
    private final TrainingService trainingService;
    private final ReindexService reindexService;
    private final Evaluator evaluator;
    private final ClassificationManager classificationManager;
    private final ResultWriter resultWriter;

    @Override
    public void run(final ApplicationArguments args) {
        final ApplicationConfig.Data data = applicationConfig.getData();
        if (data.getTrain() == null && data.getCorpus() == null) {
            log.info("No training or corpus file configured, nothing to do");
            return;
        }

        if (data.getTrain() != null) {
            train(data.getTrain());
        }
        if (data.getCorpus() == null) {
            if (data.getEval() != null || data.getPredict() != null) {
                log.warn("Evaluation and prediction need labelrecall.data.corpus, skipping them");
            }
            return;
        }
        index(data.getCorpus());
        if (data.getEval() != null) {
            evaluate(data.getEval());
        }
        if (data.getPredict() != null) {
            predict(data.getPredict());
        }
    }

    private void train(final Path file) {
        final ParseResult<TrainingPair> pairs = recordParser.parseTrainingPairs(file);
        logMalformed("training", pairs);
        final TrainingReport report = trainingService.train(pairs.records());
        if (report.degraded()) {
            log.error("Encoder training degraded, continuing with the last good weights");
        }
    }

    private void index(final Path file) {
        final ParseResult<Example> corpus = recordParser.parseLabeled(file);
        logMalformed("corpus", corpus);
        reindexService.reindex(corpus.records());
    }

    private void evaluate(final Path file) {
        final ParseResult<Example> golden = recordParser.parseLabeled(file);
        logMalformed("evaluation", golden);
        final EvaluationReport report = evaluator.evaluate(golden.records());
        log.info("Evaluation on {}: {}", file, report.asString());
    }

    private void predict(final Path file) {
        final ParseResult<String> queries = recordParser.parseQueries(file);
        logMalformed("prediction", queries);
        final BatchReport report = classificationManager.predictBatch(queries.records());

        final Path outputDir = outputDir();
        resultWriter.writePredictions(outputDir.resolve(PREDICTIONS_FILE), report);
        resultWriter.writeRecall(outputDir.resolve(RECALL_FILE), report);
    }

    private Path outputDir() {
        if (applicationConfig.getOutput() != null) {
            return applicationConfig.getOutput();
        }
        return applicationConfig.getRoot() != null ? applicationConfig.getRoot() : Path.of(".");
    }

    private static void logMalformed(final String step, final ParseResult<?> result) {
        if (result.malformedCount() > 0) {
            log.warn("{} input: {} records loaded, {} malformed lines skipped",
                    step, result.records().size(), result.malformedCount());
        } else {
            log.info("{} input: {} records loaded", step, result.records().size());
        }
    }
}
