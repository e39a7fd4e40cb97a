package eu.virtualparadox.labelrecall.query.output;

import eu.virtualparadox.labelrecall.classify.model.Prediction;
import eu.virtualparadox.labelrecall.query.BatchReport;
import eu.virtualparadox.labelrecall.rag.retriever.model.Neighbor;
import eu.virtualparadox.labelrecall.rag.retriever.model.QueryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Writes batch results as tab-separated UTF-8 text.
 * <ul>
 *   <li>predictions: {@code text<TAB>label_path|UNCLASSIFIED<TAB>confidence}</li>
 *   <li>recall: {@code text<TAB>rank<TAB>label_path<TAB>score}, one line per neighbour</li>
 * </ul>
 */
@Slf4j
@Component
public class ResultWriter {

    public void writePredictions(final Path file, final BatchReport report) {
        write(file, writer -> writePredictions(writer, report));
        log.info("Wrote {} predictions to {}", report.size(), file);
    }

    public void writePredictions(final Writer writer, final BatchReport report) throws IOException {
        for (int i = 0; i < report.size(); i++) {
            final Prediction prediction = report.predictions().get(i);
            writer.write(report.texts().get(i));
            writer.write('\t');
            writer.write(prediction.labelAsString());
            writer.write('\t');
            writer.write(formatScore(prediction.confidence()));
            writer.write('\n');
        }
    }

    public void writeRecall(final Path file, final BatchReport report) {
        write(file, writer -> writeRecall(writer, report));
        log.info("Wrote recall lists of {} queries to {}", report.size(), file);
    }

    public void writeRecall(final Writer writer, final BatchReport report) throws IOException {
        for (int i = 0; i < report.size(); i++) {
            final String text = report.texts().get(i);
            final QueryResult result = report.recalls().get(i);
            for (final Neighbor neighbor : result.neighbors()) {
                writer.write(text);
                writer.write('\t');
                writer.write(Integer.toString(neighbor.rank()));
                writer.write('\t');
                writer.write(neighbor.labelPath().asString());
                writer.write('\t');
                writer.write(formatScore(neighbor.score()));
                writer.write('\n');
            }
        }
    }

    private static String formatScore(final double score) {
        return String.format(Locale.ROOT, "%.6f", score);
    }

    private static void write(final Path file, final WriteAction action) {
        try {
            final Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                action.write(writer);
            }
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
    }

    @FunctionalInterface
    private interface WriteAction {
        void write(Writer writer) throws IOException;
    }
}
