package eu.virtualparadox.labelrecall.ingest.parser;

import eu.virtualparadox.labelrecall.ingest.cleaner.TextCleaner;
import eu.virtualparadox.labelrecall.ingest.model.Example;
import eu.virtualparadox.labelrecall.ingest.model.TrainingPair;
import eu.virtualparadox.labelrecall.label.LabelPath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the line-delimited, tab-separated record files consumed by the pipeline.
 *
 * <h3>Formats</h3>
 * <ul>
 *   <li>corpus / evaluation: {@code text<TAB>level1##level2##...}</li>
 *   <li>training pairs: {@code query<TAB>positive text or label}</li>
 *   <li>queries: {@code text} (anything after the first tab is ignored)</li>
 * </ul>
 * <p>
 * Files are UTF-8. Blank lines are skipped. Any other line that cannot be parsed,
 * including one holding invalid UTF-8 bytes, is reported as a {@link MalformedRecord}
 * with its line number; loading continues with the next line.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecordParser {

    private static final char FIELD_DELIMITER = '\t';

    /** What the lenient file decoder substitutes for bytes that are not valid UTF-8. */
    private static final char REPLACEMENT_CHAR = '\uFFFD';

    private final TextCleaner textCleaner;

    public ParseResult<Example> parseLabeled(final Path file) {
        return withReader(file, reader -> parseLabeled(reader, file.toString()));
    }

    /**
     * Parses {@code text<TAB>label_path} records.
     */
    public ParseResult<Example> parseLabeled(final Reader reader, final String source) {
        return parse(reader, source, line -> {
            final String[] fields = split(line, 2);
            final String text = cleanText(fields[0]);
            return new Example(text, LabelPath.parse(fields[1]));
        });
    }

    public ParseResult<TrainingPair> parseTrainingPairs(final Path file) {
        return withReader(file, reader -> parseTrainingPairs(reader, file.toString()));
    }

    /**
     * Parses {@code query<TAB>positive} records. The positive side may be a joined label
     * path; it is kept verbatim so label text and label path encode identically.
     */
    public ParseResult<TrainingPair> parseTrainingPairs(final Reader reader, final String source) {
        return parse(reader, source, line -> {
            final String[] fields = split(line, 2);
            final String query = cleanText(fields[0]);
            final String positive = textCleaner.cleanText(fields[1]);
            if (positive.isEmpty()) {
                throw new IllegalArgumentException("empty positive");
            }
            return new TrainingPair(query, positive);
        });
    }

    public ParseResult<String> parseQueries(final Path file) {
        return withReader(file, reader -> parseQueries(reader, file.toString()));
    }

    public ParseResult<String> parseQueries(final Reader reader, final String source) {
        return parse(reader, source, line -> {
            final int tab = line.indexOf(FIELD_DELIMITER);
            return cleanText(tab >= 0 ? line.substring(0, tab) : line);
        });
    }

    private <T> ParseResult<T> parse(final Reader reader, final String source, final LineMapper<T> mapper) {
        final List<T> records = new ArrayList<>();
        final List<MalformedRecord> malformed = new ArrayList<>();

        try (BufferedReader buffered = new BufferedReader(reader)) {
            String line;
            int lineNumber = 0;
            while ((line = buffered.readLine()) != null) {
                lineNumber++;
                if (StringUtils.isBlank(line)) {
                    continue;
                }
                try {
                    if (line.indexOf(REPLACEMENT_CHAR) >= 0) {
                        throw new IllegalArgumentException("invalid UTF-8 byte sequence");
                    }
                    records.add(mapper.map(line));
                } catch (final IllegalArgumentException e) {
                    final MalformedRecord record = new MalformedRecord(lineNumber, line, e.getMessage());
                    log.warn("Skipping malformed record in {}: {}", source, record.asString());
                    malformed.add(record);
                }
            }
        } catch (final IOException e) {
            throw new UncheckedIOException("Unable to read records from " + source, e);
        }

        log.info("Loaded {} records from {} ({} malformed)", records.size(), source, malformed.size());
        return new ParseResult<>(records, malformed);
    }

    private String[] split(final String line, final int expectedFields) {
        final String[] fields = StringUtils.splitPreserveAllTokens(line, FIELD_DELIMITER);
        if (fields.length != expectedFields) {
            throw new IllegalArgumentException(
                    "expected " + expectedFields + " tab-separated fields but found " + fields.length);
        }
        return fields;
    }

    private String cleanText(final String raw) {
        if (raw.contains(LabelPath.SEPARATOR)) {
            throw new IllegalArgumentException("text contains the reserved separator " + LabelPath.SEPARATOR);
        }
        final String text = textCleaner.cleanText(raw);
        if (text.isEmpty()) {
            throw new IllegalArgumentException("empty text");
        }
        return text;
    }

    private static <T> ParseResult<T> withReader(final Path file, final ReaderFunction<T> function) {
        // undecodable bytes become U+FFFD so a bad line is rejected on its own
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (Reader reader = new InputStreamReader(Files.newInputStream(file), decoder)) {
            return function.apply(reader);
        } catch (final IOException e) {
            throw new UncheckedIOException("Unable to open " + file, e);
        }
    }

    @FunctionalInterface
    private interface LineMapper<T> {
        T map(String line);
    }

    @FunctionalInterface
    private interface ReaderFunction<T> {
        ParseResult<T> apply(Reader reader);
    }
}
